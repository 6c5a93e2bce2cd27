package com.pmagents.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmagents.core.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability name to worker implementation.
 * <p>
 * New domains are added by registering another {@link CapabilityWorker}. Spring beans are
 * registered at startup, followed by the HTTP endpoints configured under
 * {@code pmagents.workers.endpoints}; a later registration replaces an earlier one.
 */
@Component
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final ConcurrentHashMap<String, CapabilityWorker> workers = new ConcurrentHashMap<>();

    @Autowired
    public WorkerRegistry(@Autowired(required = false) List<CapabilityWorker> beans,
                          OrchestratorProperties properties, ObjectMapper objectMapper) {
        if (beans != null) {
            beans.forEach(this::register);
        }
        var workerProps = properties.getWorkers();
        for (Map.Entry<String, String> entry : workerProps.getEndpoints().entrySet()) {
            register(new HttpCapabilityWorker(entry.getKey(), URI.create(entry.getValue()),
                    workerProps.getConnectTimeout(), objectMapper));
        }
    }

    public WorkerRegistry() {
    }

    public void register(CapabilityWorker worker) {
        var previous = workers.put(worker.capability(), worker);
        if (previous != null && previous != worker) {
            log.warn("Worker for capability '{}' replaced: {} -> {}", worker.capability(),
                    previous.getClass().getSimpleName(), worker.getClass().getSimpleName());
        } else {
            log.info("Registered worker for capability '{}' ({})", worker.capability(),
                    worker.getClass().getSimpleName());
        }
    }

    public boolean supports(String capability) {
        return workers.containsKey(capability);
    }

    /**
     * @throws IllegalArgumentException if no worker serves the capability
     */
    public CapabilityWorker require(String capability) {
        var worker = workers.get(capability);
        if (worker == null) {
            throw new IllegalArgumentException("No worker registered for capability '" + capability + "'");
        }
        return worker;
    }

    public Set<String> capabilities() {
        return new TreeSet<>(workers.keySet());
    }
}
