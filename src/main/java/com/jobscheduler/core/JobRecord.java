package com.jobscheduler.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Externally observable metadata and status of one scheduled job.
 *
 * <p>The identity ({@code id}, {@code submittedAt}) is fixed at construction.
 * Everything else is filled in by the scheduler as the job moves through its
 * lifecycle, and each field is written at most once. Transition methods reject
 * moves the {@link JobStatus} state machine does not allow.</p>
 *
 * <p><b>Thread Safety:</b> not thread-safe. The scheduler mutates its own
 * instances only while holding its registry lock and hands callers copies
 * made by {@link #copy()}, so a record obtained from the scheduler is a
 * point-in-time snapshot that never changes underneath the caller.</p>
 *
 * @author Job Scheduler Team
 * @see JobStatus
 */
public class JobRecord {
    private final JobId id;
    private final Instant submittedAt;

    private JobStatus status;
    private Instant startedAt;
    private Instant finishedAt;
    private String error;
    private String errorTraceback;
    private JobId artifactId;

    /**
     * Create a record for a freshly submitted job, in PENDING status.
     *
     * @param id the job id
     * @param submittedAt submission time
     */
    public JobRecord(JobId id, Instant submittedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt");
        this.status = JobStatus.PENDING;
    }

    private JobRecord(JobRecord source) {
        this.id = source.id;
        this.submittedAt = source.submittedAt;
        this.status = source.status;
        this.startedAt = source.startedAt;
        this.finishedAt = source.finishedAt;
        this.error = source.error;
        this.errorTraceback = source.errorTraceback;
        this.artifactId = source.artifactId;
    }

    /**
     * @return an independent copy of this record
     */
    public JobRecord copy() {
        return new JobRecord(this);
    }

    // ==================== TRANSITIONS ====================

    /**
     * PENDING → RUNNING.
     *
     * @param at time the body started
     */
    public void markRunning(Instant at) {
        transition(JobStatus.RUNNING);
        startedAt = checkedTime(at, submittedAt, "startedAt");
    }

    /**
     * RUNNING → COMPLETED.
     *
     * @param at time the body returned
     * @param artifactId correlation id recognized in the return value, or null
     */
    public void markCompleted(Instant at, JobId artifactId) {
        transition(JobStatus.COMPLETED);
        finishedAt = checkedTime(at, startedAt, "finishedAt");
        this.artifactId = artifactId;
    }

    /**
     * RUNNING → FAILED.
     *
     * @param at time the body threw
     * @param error short summary, "ExceptionType: message"
     * @param errorTraceback full stack trace text
     */
    public void markFailed(Instant at, String error, String errorTraceback) {
        transition(JobStatus.FAILED);
        finishedAt = checkedTime(at, startedAt, "finishedAt");
        this.error = error;
        this.errorTraceback = errorTraceback;
    }

    /**
     * PENDING or RUNNING → CANCELED. Error fields stay empty.
     *
     * @param at time the cancellation was observed
     */
    public void markCanceled(Instant at) {
        transition(JobStatus.CANCELED);
        finishedAt = checkedTime(at, startedAt != null ? startedAt : submittedAt, "finishedAt");
    }

    private void transition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Job " + id + ": illegal transition " + status.name() + " -> " + next.name());
        }
        status = next;
    }

    // Clamp to the previous timestamp so the ordering invariant survives clock adjustments
    private static Instant checkedTime(Instant at, Instant notBefore, String field) {
        Objects.requireNonNull(at, field);
        return at.isBefore(notBefore) ? notBefore : at;
    }

    // ==================== ACCESSORS ====================

    public JobId getId() {
        return id;
    }

    public JobStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * @return "ExceptionType: message" for failed jobs, otherwise null
     */
    public String getError() {
        return error;
    }

    /**
     * @return the full stack trace for failed jobs, otherwise null
     */
    public String getErrorTraceback() {
        return errorTraceback;
    }

    /**
     * Correlation id returned by the job body, if its return value was a {@link JobId}.
     *
     * @return the artifact id, or null
     */
    public JobId getArtifactId() {
        return artifactId;
    }

    @Override
    public String toString() {
        return "JobRecord{" +
                "id=" + id +
                ", status=" + status.name() +
                ", submittedAt=" + submittedAt +
                ", startedAt=" + startedAt +
                ", finishedAt=" + finishedAt +
                (error != null ? ", error='" + error + '\'' : "") +
                (artifactId != null ? ", artifactId=" + artifactId : "") +
                '}';
    }
}
