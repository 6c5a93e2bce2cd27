package com.pmagents.core.worker;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the worker registry.
 * <p>
 * Reports UP with the registered capabilities, or UNKNOWN while no worker is registered
 * (every submitted graph would be rejected).
 */
@Component("workerRegistryHealthIndicator")
public class WorkerRegistryHealthIndicator implements HealthIndicator {

    private final WorkerRegistry registry;

    public WorkerRegistryHealthIndicator(WorkerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        var capabilities = registry.capabilities();
        if (capabilities.isEmpty()) {
            return Health.unknown().withDetail("reason", "no workers registered").build();
        }
        var builder = Health.up().withDetail("capabilityCount", capabilities.size());
        for (var capability : capabilities) {
            var worker = registry.require(capability);
            builder.withDetail(capability, worker instanceof HttpCapabilityWorker http
                    ? "http " + http.endpoint()
                    : worker.getClass().getSimpleName());
        }
        return builder.build();
    }
}
