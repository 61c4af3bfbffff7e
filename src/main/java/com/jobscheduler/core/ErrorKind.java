package com.jobscheduler.core;

/**
 * Closed set of failure kinds reported by the scheduler.
 *
 * <p>All kinds except {@link #JOB_FAILURE} describe misuse of the scheduler and are
 * thrown synchronously by the offending call. {@code JOB_FAILURE} wraps the job
 * body's own captured exception and only surfaces from
 * {@link JobScheduler#getResult(JobId)}.</p>
 *
 * @author Job Scheduler Team
 * @see JobSchedulerException
 */
public enum ErrorKind {
    /** No job with the given id. */
    NOT_FOUND,
    /** Arguments supplied with a pre-built deferred computation. */
    INVALID_ARGUMENT,
    /** Freshly generated id already registered. */
    ALREADY_SCHEDULED,
    /** Result requested before the job completed. */
    NOT_FINISHED,
    /** {@code wait} deadline expired. */
    TIMEOUT,
    /** The job body threw. */
    JOB_FAILURE
}
