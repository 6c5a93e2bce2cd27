package com.pmagents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PmAgentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PmAgentsApplication.class, args);
    }
}
