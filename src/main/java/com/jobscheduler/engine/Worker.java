package com.jobscheduler.engine;

import com.jobscheduler.core.JobContext;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobRecord;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the lifecycle of a single job.
 *
 * <p>Each Worker handles the complete lifecycle of one job:</p>
 * <ul>
 *   <li>Wait for a concurrency permit (without holding a thread)</li>
 *   <li>Mark the job RUNNING and start its body on the dispatcher thread</li>
 *   <li>Handle success: COMPLETED, result stored</li>
 *   <li>Handle cancellation: CANCELED, no error fields</li>
 *   <li>Handle failure: FAILED, with error summary and stack trace captured</li>
 *   <li>Release the permit and fire the job's completion signal</li>
 * </ul>
 *
 * <p><b>Error Handling Strategy:</b></p>
 * <ul>
 *   <li>InterruptedException or CancellationException → CANCELED</li>
 *   <li>Any other Throwable → FAILED</li>
 *   <li>Nothing thrown by the body ever propagates out of the Worker</li>
 * </ul>
 *
 * <p>A job cancelled while still waiting for its permit goes straight from
 * PENDING to CANCELED and its body never runs.</p>
 *
 * @author Job Scheduler Team
 * @see Scheduler
 * @see ConcurrencyLimiter
 */
class Worker {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final JobId jobId;
    private final JobThunk thunk;
    private final JobHandle handle;
    private final JobRegistry registry;
    private final ConcurrencyLimiter limiter;
    private final Executor dispatcher;

    /**
     * @param jobId the job to run
     * @param thunk its normalized body
     * @param handle its handle, completed when the worker is done
     * @param registry where state transitions are recorded
     * @param limiter the limiter in force when the job was submitted
     * @param dispatcher executor that starts job bodies
     */
    Worker(JobId jobId, JobThunk thunk, JobHandle handle, JobRegistry registry,
           ConcurrencyLimiter limiter, Executor dispatcher) {
        this.jobId = jobId;
        this.thunk = thunk;
        this.handle = handle;
        this.registry = registry;
        this.limiter = limiter;
        this.dispatcher = dispatcher;
    }

    /**
     * Request a permit and arrange for the body to start once it is granted.
     * Returns without waiting.
     */
    void start() {
        JobContext context = handle.getContext();
        CompletableFuture<ConcurrencyLimiter.Permit> permitRequest = limiter.acquire();

        // Withdraw from the limiter queue if cancelled while pending
        context.onCancel(() -> permitRequest.cancel(false));

        permitRequest.whenComplete((permit, error) -> {
            if (error != null) {
                finishCanceledBeforeStart();
                return;
            }
            try {
                dispatcher.execute(() -> run(permit));
            } catch (RejectedExecutionException e) {
                logger.warning("Dispatcher rejected job " + jobId + ", scheduler is shutting down");
                permit.release();
                finishCanceledBeforeStart();
            }
        });
    }

    private void run(ConcurrencyLimiter.Permit permit) {
        JobContext context = handle.getContext();

        if (context.isCancelled() || registry.markRunning(jobId, Instant.now()) == null) {
            permit.release();
            finishCanceledBeforeStart();
            return;
        }

        logger.info("Job " + jobId + " started");
        long startTime = System.currentTimeMillis();

        CompletableFuture<Object> body;
        try {
            body = thunk.start(context);
        } catch (Throwable t) {
            body = CompletableFuture.failedFuture(t);
        }

        body.whenComplete((value, error) -> finish(permit, value, error, startTime));
    }

    private void finish(ConcurrencyLimiter.Permit permit, Object value, Throwable error, long startTime) {
        JobRecord terminal = null;
        long duration = System.currentTimeMillis() - startTime;
        try {
            Instant now = Instant.now();
            if (error == null) {
                terminal = registry.markCompleted(jobId, now, value);
                logger.info("Job " + jobId + " completed in " + duration + "ms");
            } else {
                Throwable cause = JobExecutor.unwrap(error);
                if (isCancellation(cause)) {
                    terminal = registry.markCanceled(jobId, now);
                    logger.warning("Job " + jobId + " was cancelled after " + duration + "ms");
                } else {
                    terminal = registry.markFailed(jobId, now, summarize(cause), traceback(cause));
                    logger.log(Level.SEVERE, "Job " + jobId + " failed after " + duration + "ms", cause);
                }
            }
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to record outcome of job " + jobId, e);
        } finally {
            permit.release();
            handle.complete(terminal);
        }
    }

    private void finishCanceledBeforeStart() {
        JobRecord terminal = null;
        try {
            terminal = registry.markCanceled(jobId, Instant.now());
            thunk.abandon();
            logger.info("Job " + jobId + " cancelled before it started");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to record cancellation of job " + jobId, e);
        } finally {
            handle.complete(terminal);
        }
    }

    /**
     * True if the throwable, or anything in its cause chain, signals cancellation.
     */
    static boolean isCancellation(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Short form of a failure: "ExceptionType: message", or just the type when there is no message.
     */
    static String summarize(Throwable error) {
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        return (message == null || message.isBlank()) ? type : type + ": " + message;
    }

    static String traceback(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
