package com.jobscheduler.engine;

import com.jobscheduler.core.AsyncJobFunction;
import com.jobscheduler.core.ErrorKind;
import com.jobscheduler.core.JobArguments;
import com.jobscheduler.core.JobContext;
import com.jobscheduler.core.JobFunction;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobSchedulerException;
import com.jobscheduler.core.JobTarget;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Adapts the three {@link JobTarget} shapes to one execution protocol.
 *
 * <ul>
 *   <li>SYNC: submitted to the worker pool. Cancellation interrupts the worker
 *       thread, or drops the task if it has not started yet.</li>
 *   <li>ASYNC: the function is invoked with context and arguments and its stage
 *       is awaited. Cancellation cancels the stage.</li>
 *   <li>DEFERRED: the stage is awaited as-is. Cancellation cancels the stage,
 *       also when the job is cancelled before it starts. Arguments are rejected
 *       at submission.</li>
 * </ul>
 *
 * @author Job Scheduler Team
 * @see Worker
 */
public class JobExecutor {
    private static final Logger logger = Logger.getLogger(JobExecutor.class.getName());

    private final ExecutorService workerPool;

    /**
     * @param workerPool pool that runs synchronous job bodies
     */
    public JobExecutor(ExecutorService workerPool) {
        this.workerPool = workerPool;
    }

    /**
     * Normalize a target and its arguments into a thunk.
     *
     * @param jobId id of the job being prepared, for error reporting
     * @param target the job target
     * @param arguments bound arguments
     * @return the thunk to hand to a {@link Worker}
     * @throws JobSchedulerException INVALID_ARGUMENT if a deferred target carries arguments
     */
    JobThunk prepare(JobId jobId, JobTarget target, JobArguments arguments) {
        JobArguments args = arguments != null ? arguments : JobArguments.none();

        return switch (target.getKind()) {
            case SYNC -> context -> runOnWorkerPool(target.getFunction(), args, context);
            case ASYNC -> context -> startAsync(target.getAsyncFunction(), args, context);
            case DEFERRED -> {
                if (!args.isEmpty()) {
                    throw new JobSchedulerException(ErrorKind.INVALID_ARGUMENT, jobId,
                        "Arguments are not supported when the target is a pre-built deferred computation");
                }
                CompletableFuture<?> stage = target.getDeferred().toCompletableFuture();
                yield new JobThunk() {
                    @Override
                    public CompletableFuture<Object> start(JobContext context) {
                        return await(stage, context);
                    }

                    @Override
                    public void abandon() {
                        // Already running independently of the job
                        stage.cancel(true);
                    }
                };
            }
        };
    }

    private CompletableFuture<Object> runOnWorkerPool(JobFunction function, JobArguments args, JobContext context) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        // Whoever flips this first owns the outcome: the body (started) or cancel (never ran)
        AtomicBoolean claimed = new AtomicBoolean(false);

        Future<?> task;
        try {
            task = workerPool.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return;
                }
                try {
                    result.complete(function.apply(context, args));
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warning("Worker pool rejected job " + context.getJobId() + ": " + e.getMessage());
            result.completeExceptionally(e);
            return result;
        }

        context.onCancel(() -> {
            if (claimed.compareAndSet(false, true)) {
                task.cancel(false);
                result.completeExceptionally(
                    new CancellationException("Job " + context.getJobId() + " cancelled before it started"));
            } else {
                task.cancel(true); // interrupt the running body
            }
        });
        return result;
    }

    private CompletableFuture<Object> startAsync(AsyncJobFunction function, JobArguments args, JobContext context) {
        CompletionStage<?> stage;
        try {
            stage = function.apply(context, args);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(null);
        }
        return await(stage, context);
    }

    private CompletableFuture<Object> await(CompletionStage<?> stage, JobContext context) {
        CompletableFuture<?> source = stage.toCompletableFuture();
        CompletableFuture<Object> result = new CompletableFuture<>();

        source.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(unwrap(error));
            }
        });
        context.onCancel(() -> source.cancel(true));
        return result;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
