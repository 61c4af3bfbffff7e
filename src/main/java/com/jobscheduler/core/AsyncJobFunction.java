package com.jobscheduler.core;

import java.util.concurrent.CompletionStage;

/**
 * An asynchronous job body: starts work and returns a stage that completes with
 * the result.
 *
 * <p>The function itself is called on a scheduler thread and should return
 * quickly. When the job is cancelled the scheduler cancels the returned stage
 * (through {@code toCompletableFuture().cancel(true)}) and sets the context's
 * cancellation flag.</p>
 *
 * @author Job Scheduler Team
 * @see JobTarget#async(AsyncJobFunction)
 */
@FunctionalInterface
public interface AsyncJobFunction {

    /**
     * @param context execution context
     * @param arguments the arguments bound at submission
     * @return stage completing with the job result; null is treated as a completed null result
     * @throws Exception if the work cannot be started
     */
    CompletionStage<?> apply(JobContext context, JobArguments arguments) throws Exception;
}
