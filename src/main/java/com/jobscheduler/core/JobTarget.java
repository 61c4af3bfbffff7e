package com.jobscheduler.core;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;

/**
 * What a job executes: one of three shapes.
 *
 * <ul>
 *   <li>{@link Kind#SYNC}: a {@link JobFunction}, run on the scheduler's worker pool</li>
 *   <li>{@link Kind#ASYNC}: an {@link AsyncJobFunction}, whose returned stage is awaited</li>
 *   <li>{@link Kind#DEFERRED}: a computation already in flight, awaited as-is. It
 *       takes no arguments.</li>
 * </ul>
 *
 * @author Job Scheduler Team
 */
public final class JobTarget {

    /**
     * Shape of a target.
     */
    public enum Kind {
        SYNC,
        ASYNC,
        DEFERRED
    }

    private final Kind kind;
    private final JobFunction function;
    private final AsyncJobFunction asyncFunction;
    private final CompletionStage<?> deferred;

    private JobTarget(Kind kind, JobFunction function, AsyncJobFunction asyncFunction, CompletionStage<?> deferred) {
        this.kind = kind;
        this.function = function;
        this.asyncFunction = asyncFunction;
        this.deferred = deferred;
    }

    public static JobTarget of(JobFunction function) {
        return new JobTarget(Kind.SYNC, Objects.requireNonNull(function, "function"), null, null);
    }

    /**
     * Synchronous target that ignores context and arguments.
     *
     * @param callable the body
     * @return the target
     */
    public static JobTarget ofCallable(Callable<?> callable) {
        Objects.requireNonNull(callable, "callable");
        return new JobTarget(Kind.SYNC, (context, arguments) -> callable.call(), null, null);
    }

    public static JobTarget async(AsyncJobFunction function) {
        return new JobTarget(Kind.ASYNC, null, Objects.requireNonNull(function, "function"), null);
    }

    public static JobTarget deferred(CompletionStage<?> stage) {
        return new JobTarget(Kind.DEFERRED, null, null, Objects.requireNonNull(stage, "stage"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the body for {@link Kind#SYNC}, otherwise null
     */
    public JobFunction getFunction() {
        return function;
    }

    /**
     * @return the body for {@link Kind#ASYNC}, otherwise null
     */
    public AsyncJobFunction getAsyncFunction() {
        return asyncFunction;
    }

    /**
     * @return the stage for {@link Kind#DEFERRED}, otherwise null
     */
    public CompletionStage<?> getDeferred() {
        return deferred;
    }

    @Override
    public String toString() {
        return "JobTarget{" + kind.name() + '}';
    }
}
