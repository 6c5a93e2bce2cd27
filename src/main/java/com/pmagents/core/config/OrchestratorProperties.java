package com.pmagents.core.config;

import com.pmagents.core.model.TaskPriority;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service-wide defaults for graph execution. Every value can be overridden per request
 * through {@link com.pmagents.core.model.ExecutionOptions}.
 */
@Component
@ConfigurationProperties(prefix = "pmagents")
public class OrchestratorProperties {

    private Pool pool = new Pool();
    private Retry retry = new Retry();
    private Breaker breaker = new Breaker();
    private Run run = new Run();
    private Workers workers = new Workers();

    // -- Flat accessors (delegate to nested) --
    public int getMaxPerCapability() { return pool.maxPerCapability; }
    public int getMaxRetries() { return retry.maxRetries; }
    public Duration getTaskTimeout() { return retry.taskTimeout; }
    public int getFailureThreshold() { return breaker.failureThreshold; }
    public Duration getResetTimeout() { return breaker.resetTimeout; }
    public Duration getDefaultBudget() { return run.defaultBudget; }
    public Duration getProgressInterval() { return run.progressInterval; }

    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Breaker getBreaker() { return breaker; }
    public void setBreaker(Breaker breaker) { this.breaker = breaker; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }

    public static class Pool {
        private int maxPerCapability = 3;
        /** Per-capability overrides of {@code maxPerCapability}. */
        private Map<String, Integer> capabilityLimits = new LinkedHashMap<>();

        public int getMaxPerCapability() { return maxPerCapability; }
        public void setMaxPerCapability(int maxPerCapability) { this.maxPerCapability = maxPerCapability; }
        public Map<String, Integer> getCapabilityLimits() { return capabilityLimits; }
        public void setCapabilityLimits(Map<String, Integer> capabilityLimits) { this.capabilityLimits = capabilityLimits; }
    }

    public static class Retry {
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private Duration taskTimeout = Duration.ofMinutes(5);
        private double timeoutMultiplier = 1.5;
        private Duration maxTimeout = Duration.ofMinutes(15);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
        public double getTimeoutMultiplier() { return timeoutMultiplier; }
        public void setTimeoutMultiplier(double timeoutMultiplier) { this.timeoutMultiplier = timeoutMultiplier; }
        public Duration getMaxTimeout() { return maxTimeout; }
        public void setMaxTimeout(Duration maxTimeout) { this.maxTimeout = maxTimeout; }
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getResetTimeout() { return resetTimeout; }
        public void setResetTimeout(Duration resetTimeout) { this.resetTimeout = resetTimeout; }
    }

    public static class Run {
        private Duration defaultBudget = Duration.ofHours(1);
        private Duration progressInterval = Duration.ofSeconds(10);
        /** Wall-clock time corresponding to one unit of a task's estimated cost. */
        private Duration costUnit = Duration.ofSeconds(1);
        /** Dependents of failed tasks below this priority are skipped without an issue. */
        private TaskPriority skipPriorityFloor = TaskPriority.MEDIUM;
        /** How many finished executions are kept for status queries and retries. */
        private int retainedExecutions = 100;

        public Duration getDefaultBudget() { return defaultBudget; }
        public void setDefaultBudget(Duration defaultBudget) { this.defaultBudget = defaultBudget; }
        public Duration getProgressInterval() { return progressInterval; }
        public void setProgressInterval(Duration progressInterval) { this.progressInterval = progressInterval; }
        public Duration getCostUnit() { return costUnit; }
        public void setCostUnit(Duration costUnit) { this.costUnit = costUnit; }
        public TaskPriority getSkipPriorityFloor() { return skipPriorityFloor; }
        public void setSkipPriorityFloor(TaskPriority skipPriorityFloor) { this.skipPriorityFloor = skipPriorityFloor; }
        public int getRetainedExecutions() { return retainedExecutions; }
        public void setRetainedExecutions(int retainedExecutions) { this.retainedExecutions = retainedExecutions; }
    }

    public static class Workers {
        /** Capability name to HTTP endpoint of a remote worker. */
        private Map<String, String> endpoints = new LinkedHashMap<>();
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Map<String, String> getEndpoints() { return endpoints; }
        public void setEndpoints(Map<String, String> endpoints) { this.endpoints = endpoints; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    }
}
