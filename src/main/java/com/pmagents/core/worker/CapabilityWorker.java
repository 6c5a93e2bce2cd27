package com.pmagents.core.worker;

import com.pmagents.core.model.TaskRequest;
import com.pmagents.core.model.TaskResult;

/**
 * A worker able to execute tasks of one capability (e.g. "code-generator").
 * <p>
 * Implementations: {@link HttpCapabilityWorker} for remote workers, or any Spring bean
 * implementing this interface, which {@link WorkerRegistry} picks up automatically.
 * Implementations should honour thread interruption, which is how a timed-out or
 * cancelled call is abandoned.
 */
public interface CapabilityWorker {

    /**
     * The capability name this worker serves.
     */
    String capability();

    /**
     * Executes one attempt of a task.
     *
     * @throws Exception any failure; the proxy wraps it as {@link WorkerFailureException}
     */
    TaskResult execute(TaskRequest request) throws Exception;
}
