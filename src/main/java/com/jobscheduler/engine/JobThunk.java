package com.jobscheduler.engine;

import com.jobscheduler.core.JobContext;

import java.util.concurrent.CompletableFuture;

/**
 * A job target normalized to a single shape: start the work, get back a future.
 *
 * <p>Produced once per job by {@link JobExecutor#prepare}. Implementations wire
 * {@link JobContext#cancel()} to whatever stops the underlying work (thread
 * interrupt, stage cancellation).</p>
 */
@FunctionalInterface
interface JobThunk {

    /**
     * @param context the job's context
     * @return future completing with the body's result, or exceptionally with its error
     */
    CompletableFuture<Object> start(JobContext context);

    /**
     * Called instead of {@link #start} when the job is cancelled before it ever
     * runs. Work that already exists independently of the job is stopped here.
     */
    default void abandon() {
    }
}
