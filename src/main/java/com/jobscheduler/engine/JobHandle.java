package com.jobscheduler.engine;

import com.jobscheduler.core.JobContext;
import com.jobscheduler.core.JobRecord;

import java.util.concurrent.CompletableFuture;

/**
 * Scheduler-internal bookkeeping for one job: its cancellable context and a
 * completion signal fired once the worker has recorded a terminal state.
 *
 * <p>The completion signal itself is never exposed. Observers get
 * {@link CompletableFuture#copy() copies}, so cancelling or timing out an
 * observer cannot complete or cancel the job's own signal.</p>
 */
final class JobHandle {
    private final JobContext context;
    private final CompletableFuture<JobRecord> done = new CompletableFuture<>();

    JobHandle(JobContext context) {
        this.context = context;
    }

    JobContext getContext() {
        return context;
    }

    /**
     * @return a non-owning view of the completion signal
     */
    CompletableFuture<JobRecord> observe() {
        return done.copy();
    }

    /**
     * Block until the worker is done with the job. Not interruptible.
     *
     * @return the terminal record, or null if it could not be recorded
     */
    JobRecord awaitDone() {
        return done.join();
    }

    boolean isDone() {
        return done.isDone();
    }

    void complete(JobRecord terminalRecord) {
        done.complete(terminalRecord);
    }
}
