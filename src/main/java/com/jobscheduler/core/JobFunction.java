package com.jobscheduler.core;

/**
 * A synchronous job body. The scheduler runs it on its worker pool.
 *
 * <p>Throwing InterruptedException (for example from
 * {@link JobContext#throwIfCancelled()} or a blocking call interrupted by
 * cancellation) marks the job CANCELED; any other exception marks it FAILED.</p>
 *
 * @author Job Scheduler Team
 * @see JobTarget#of(JobFunction)
 */
@FunctionalInterface
public interface JobFunction {

    /**
     * Execute the job's business logic.
     *
     * @param context execution context for cancellation checks and logging
     * @param arguments the arguments bound at submission
     * @return the job result, stored by the scheduler and returned by getResult
     * @throws Exception if execution fails
     */
    Object apply(JobContext context, JobArguments arguments) throws Exception;
}
