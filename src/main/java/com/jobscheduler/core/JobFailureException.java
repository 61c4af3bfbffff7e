package com.jobscheduler.core;

/**
 * Thrown by {@link JobScheduler#getResult(JobId)} when the job body failed.
 *
 * <p>The original exception is not kept. It was captured as text when the job
 * failed: {@link #getError()} holds the short "ExceptionType: message" summary
 * and {@link #getErrorTraceback()} the full stack trace.</p>
 *
 * @author Job Scheduler Team
 */
public class JobFailureException extends JobSchedulerException {

    private final String error;
    private final String errorTraceback;

    /**
     * @param jobId the failed job
     * @param error short summary of the captured exception
     * @param errorTraceback full captured stack trace, may be null
     */
    public JobFailureException(JobId jobId, String error, String errorTraceback) {
        super(ErrorKind.JOB_FAILURE, jobId, "Job " + jobId + " failed: " + error);
        this.error = error;
        this.errorTraceback = errorTraceback;
    }

    public String getError() {
        return error;
    }

    public String getErrorTraceback() {
        return errorTraceback;
    }
}
