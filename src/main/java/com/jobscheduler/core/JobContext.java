package com.jobscheduler.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Execution context handed to a job body.
 *
 * <p>This class is the bridge between a job's business logic and the scheduler.
 * It provides:</p>
 * <ul>
 *   <li>The id of the job being executed</li>
 *   <li>Cooperative cancellation checking via an atomic flag</li>
 *   <li>Cancellation callbacks, used by the scheduler to interrupt or cancel the body</li>
 *   <li>Logging tagged with the job id</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. The cancellation flag uses
 * AtomicBoolean, and callback registration is synchronized so a callback added
 * concurrently with {@link #cancel()} runs exactly once.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * JobTarget.of((context, args) -> {
 *     for (Item item : items) {
 *         context.throwIfCancelled(); // Check for cancellation
 *         process(item);
 *     }
 *     return items.size();
 * });
 * }</pre>
 *
 * @author Job Scheduler Team
 * @see JobFunction
 * @see AsyncJobFunction
 */
public class JobContext {
    private static final Logger logger = Logger.getLogger(JobContext.class.getName());

    private final JobId jobId;
    private final AtomicBoolean cancelled;
    private final List<Runnable> cancelCallbacks;

    /**
     * Create a new job context.
     *
     * @param jobId the id of the job being executed
     */
    public JobContext(JobId jobId) {
        this.jobId = jobId;
        this.cancelled = new AtomicBoolean(false);
        this.cancelCallbacks = new ArrayList<>();
    }

    /**
     * Get the id of the job being executed.
     *
     * @return the job id
     */
    public JobId getJobId() {
        return jobId;
    }

    /**
     * Log a message tagged with the job id.
     *
     * @param level the log level
     * @param message the log message
     */
    public void log(Level level, String message) {
        logger.log(level, "[job " + jobId + "] " + message);
    }

    /**
     * Check if cancellation has been requested.
     *
     * @return true if the job was cancelled
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Request cancellation and run the registered callbacks.
     *
     * <p>Setting the flag does not stop execution by itself. The body sees the
     * request when it calls {@link #throwIfCancelled()}, when its thread is
     * interrupted by a callback, or when its returned stage is cancelled.</p>
     *
     * @return true if this call made the request, false if it had already been made
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }

        List<Runnable> callbacks;
        synchronized (cancelCallbacks) {
            callbacks = new ArrayList<>(cancelCallbacks);
            cancelCallbacks.clear();
        }
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
        return true;
    }

    /**
     * Register a callback to run when cancellation is requested. If it already
     * was, the callback runs immediately on the calling thread.
     *
     * @param callback the action to run
     */
    public void onCancel(Runnable callback) {
        synchronized (cancelCallbacks) {
            if (!cancelled.get()) {
                cancelCallbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            logger.log(Level.WARNING, "Cancellation callback failed for job " + jobId, e);
        }
    }

    /**
     * Throw InterruptedException if cancellation has been requested.
     *
     * <p><b>Cancellation Checkpoint:</b> Jobs should call this periodically during
     * long-running work. The scheduler records a job that ends with
     * InterruptedException as CANCELED rather than FAILED.</p>
     *
     * @throws InterruptedException if the job has been cancelled
     */
    public void throwIfCancelled() throws InterruptedException {
        if (cancelled.get()) {
            throw new InterruptedException("Job " + jobId + " was cancelled");
        }
    }

    @Override
    public String toString() {
        return "JobContext{" +
                "jobId=" + jobId +
                ", cancelled=" + cancelled.get() +
                '}';
    }
}
