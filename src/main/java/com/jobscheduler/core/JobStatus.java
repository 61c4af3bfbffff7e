package com.jobscheduler.core;

import java.util.Locale;

/**
 * Enum representing the states a scheduled job moves through.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → RUNNING: a concurrency permit was granted and the body started</li>
 *   <li>PENDING → CANCELED: job canceled while still waiting for a permit</li>
 *   <li>RUNNING → COMPLETED: body returned a value</li>
 *   <li>RUNNING → FAILED: body threw an exception</li>
 *   <li>RUNNING → CANCELED: body observed a cancellation request</li>
 * </ul>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @author Job Scheduler Team
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("Pending"),
    RUNNING("Running"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELED("Canceled");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable display name for this status.
     *
     * @return the display name (e.g., "Completed", "Failed")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Lower-case wire name, as used in serialized records ("pending", "running", ...).
     *
     * @return the wire name of this status
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Check if this status represents a terminal state.
     * Terminal states are final - jobs cannot transition out of them.
     *
     * @return true if the job has reached a final state (COMPLETED, FAILED, or CANCELED)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * <p>Key Invariant: Once a job reaches a terminal state it cannot transition
     * to any other state.</p>
     *
     * @param newStatus the target status to transition to
     * @return true if the transition is allowed, false if it violates state machine rules
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newStatus == RUNNING || newStatus == CANCELED;
            case RUNNING -> newStatus == COMPLETED || newStatus == FAILED || newStatus == CANCELED;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
