package com.pmagents.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmagents.core.model.ResultStatus;
import com.pmagents.core.model.Task;
import com.pmagents.core.model.TaskRequest;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpCapabilityWorkerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private HttpServer server;
    private volatile int status = 200;
    private volatile String responseBody = "";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/execute", exchange -> {
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            var bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private HttpCapabilityWorker worker() {
        var uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/execute");
        return new HttpCapabilityWorker("doc-generator", uri, Duration.ofSeconds(2), objectMapper);
    }

    private static TaskRequest request() {
        return TaskRequest.forAttempt(Task.of("DOC-1", "doc-generator", Set.of()), Map.of("project", "demo"), 2);
    }

    @Test
    @DisplayName("posts the request as JSON and reads the result")
    void roundTrip() throws Exception {
        responseBody = """
                {"status":"SUCCESS","deliverables":[{"path":"README.md","type":"markdown","content":"# Demo"}],
                 "validationPassed":true,"errorDetail":null,"metrics":{"errors":0.0}}
                """;

        var result = worker().execute(request());

        assertEquals(ResultStatus.SUCCESS, result.status());
        assertEquals("README.md", result.deliverables().get(0).path());
        assertEquals(0.0, result.metrics().get("errors"));

        var sent = objectMapper.readTree(receivedBody.get());
        assertEquals("DOC-1", sent.get("taskId").asText());
        assertEquals(2, sent.get("attempt").asInt());
        assertEquals("demo", sent.get("context").get("project").asText());
    }

    @Test
    @DisplayName("HTTP error status becomes an IOException")
    void httpError() {
        status = 503;
        responseBody = "{\"error\":\"overloaded\"}";

        var ex = assertThrows(IOException.class, () -> worker().execute(request()));

        assertTrue(ex.getMessage().contains("503"));
        assertTrue(ex.getMessage().contains("overloaded"));
    }

    @Test
    @DisplayName("unreachable endpoint becomes an IOException")
    void unreachable() {
        var worker = worker();
        server.stop(0);

        assertThrows(IOException.class, () -> worker.execute(request()));
    }
}
