package com.jobscheduler.core;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-process background job scheduler.
 *
 * <p>Jobs are submitted as {@link JobTarget}s and identified by a {@link JobId}
 * returned before the body runs. Callers observe progress by polling
 * {@link #getRecord(JobId)}, block on {@link #await(JobId, Duration)}, and read
 * the outcome with {@link #getResult(JobId)}.</p>
 *
 * <p>Scheduler misuse is reported as {@link JobSchedulerException} with an
 * {@link ErrorKind}. A job body's own exception never escapes the scheduler's
 * threads: the job ends FAILED and only {@code getResult} rethrows it, as a
 * {@link JobFailureException}.</p>
 *
 * @author Job Scheduler Team
 */
public interface JobScheduler {

    /**
     * Submit a job with no arguments.
     *
     * @param target what to execute
     * @return the new job's id
     */
    default JobId addJob(JobTarget target) {
        return addJob(target, JobArguments.none());
    }

    /**
     * Submit a job. Returns immediately, before the body starts.
     *
     * @param target what to execute
     * @param arguments arguments bound to a callable target
     * @return the new job's id
     * @throws JobSchedulerException INVALID_ARGUMENT if a deferred target is given
     *         arguments, ALREADY_SCHEDULED on an id collision
     */
    JobId addJob(JobTarget target, JobArguments arguments);

    /**
     * @throws JobSchedulerException NOT_FOUND for an unknown id
     */
    JobStatus getStatus(JobId jobId);

    /**
     * @return a point-in-time copy of the job's record
     * @throws JobSchedulerException NOT_FOUND for an unknown id
     */
    JobRecord getRecord(JobId jobId);

    /**
     * @return copies of all records, most recently submitted first
     */
    List<JobRecord> getAllRecords();

    /**
     * @param status only records currently in this status
     * @return matching record copies, most recently submitted first
     */
    List<JobRecord> getAllRecords(JobStatus status);

    /**
     * Cancel a job that has not finished and wait until its outcome is recorded.
     *
     * <p>Cancellation is cooperative: a job that finishes on its own before it
     * observes the request keeps its COMPLETED or FAILED outcome.</p>
     *
     * @return true if the job ended CANCELED, false if it was already terminal or
     *         finished without observing the request
     * @throws JobSchedulerException NOT_FOUND for an unknown id
     */
    boolean cancel(JobId jobId);

    /**
     * Cancel the job if still active, then forget its record, result and handle.
     *
     * @throws JobSchedulerException NOT_FOUND for an unknown id
     */
    void delete(JobId jobId);

    /**
     * Block until the job reaches a terminal state.
     *
     * @throws JobSchedulerException NOT_FOUND for an unknown id
     * @throws InterruptedException if the waiting thread is interrupted; the job is unaffected
     */
    void await(JobId jobId) throws InterruptedException;

    /**
     * Block until the job reaches a terminal state or the timeout expires.
     * An expired wait never cancels the job.
     *
     * @param timeout maximum time to wait, null for no limit
     * @throws JobSchedulerException TIMEOUT on expiry, NOT_FOUND for an unknown id
     * @throws InterruptedException if the waiting thread is interrupted; the job is unaffected
     */
    void await(JobId jobId, Duration timeout) throws InterruptedException;

    /**
     * Non-blocking form of {@link #await(JobId)}. Cancelling the returned future
     * does not cancel the job.
     *
     * @return future completing with the terminal record
     * @throws JobSchedulerException NOT_FOUND for an unknown id
     */
    CompletableFuture<JobRecord> whenDone(JobId jobId);

    /**
     * @return the job's return value
     * @throws JobSchedulerException NOT_FOUND for an unknown id, NOT_FINISHED while
     *         pending or running (or if canceled)
     * @throws JobFailureException if the job failed
     */
    Object getResult(JobId jobId);

    /**
     * Typed form of {@link #getResult(JobId)}.
     *
     * @throws ClassCastException if the result is not of the requested type
     */
    default <T> T getResult(JobId jobId, Class<T> type) {
        return type.cast(getResult(jobId));
    }

    /**
     * Replace the concurrency ceiling. Jobs already holding a slot keep it.
     *
     * @param maxConcurrency new ceiling; null, zero or negative for unbounded
     */
    void setMaxConcurrency(Integer maxConcurrency);

    /**
     * @return the current ceiling, or null when unbounded
     */
    Integer getMaxConcurrency();
}
