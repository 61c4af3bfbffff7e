package com.jobscheduler.core;

/**
 * Unchecked exception thrown by {@link JobScheduler} operations.
 *
 * <p>Every instance carries an {@link ErrorKind} so callers (an HTTP layer, a CLI)
 * can map it to their own error representation without parsing messages:</p>
 * <pre>{@code
 * try {
 *     scheduler.getRecord(id);
 * } catch (JobSchedulerException e) {
 *     if (e.getKind() == ErrorKind.NOT_FOUND) {
 *         return notFound();
 *     }
 *     throw e;
 * }
 * }</pre>
 *
 * @author Job Scheduler Team
 * @see JobFailureException
 */
public class JobSchedulerException extends RuntimeException {

    private final ErrorKind kind;
    private final JobId jobId;

    /**
     * @param kind the error kind
     * @param jobId the job the error refers to, or null
     * @param message the error message
     */
    public JobSchedulerException(ErrorKind kind, JobId jobId, String message) {
        super(message);
        this.kind = kind;
        this.jobId = jobId;
    }

    /**
     * @param kind the error kind
     * @param jobId the job the error refers to, or null
     * @param message the error message
     * @param cause the underlying cause
     */
    public JobSchedulerException(ErrorKind kind, JobId jobId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.jobId = jobId;
    }

    /**
     * Shorthand for the {@link ErrorKind#NOT_FOUND} case.
     *
     * @param jobId the unknown id
     * @return a new exception, not thrown
     */
    public static JobSchedulerException notFound(JobId jobId) {
        return new JobSchedulerException(ErrorKind.NOT_FOUND, jobId, "Job not found: " + jobId);
    }

    /**
     * Get the kind of failure.
     *
     * @return the error kind, never null
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Get the id of the job involved.
     *
     * @return the job id, or null if the error is not tied to a job
     */
    public JobId getJobId() {
        return jobId;
    }
}
