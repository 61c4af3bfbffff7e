package com.jobscheduler.engine;

import com.jobscheduler.core.ErrorKind;
import com.jobscheduler.core.JobFailureException;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobRecord;
import com.jobscheduler.core.JobSchedulerException;
import com.jobscheduler.core.JobStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Id-keyed job state: records, results and handles.
 *
 * <p><b>Thread Safety:</b> every method is {@code synchronized} on the registry,
 * which is the scheduler's single guard for shared job state. Records never
 * leave the registry: readers receive copies made while the lock is held.</p>
 *
 * @author Job Scheduler Team
 * @see Scheduler
 */
class JobRegistry {

    private static final Comparator<JobRecord> NEWEST_FIRST =
        Comparator.comparing(JobRecord::getSubmittedAt)
            .thenComparing(JobRecord::getId)
            .reversed();

    private final Map<JobId, JobRecord> records = new HashMap<>();
    private final Map<JobId, Object> results = new HashMap<>();
    private final Map<JobId, JobHandle> handles = new HashMap<>();

    synchronized void register(JobRecord record, JobHandle handle) {
        JobId id = record.getId();
        if (records.containsKey(id) || handles.containsKey(id)) {
            throw new JobSchedulerException(ErrorKind.ALREADY_SCHEDULED, id, "Job " + id + " already scheduled");
        }
        records.put(id, record);
        handles.put(id, handle);
    }

    synchronized JobRecord snapshot(JobId id) {
        return require(id).copy();
    }

    synchronized JobStatus status(JobId id) {
        return require(id).getStatus();
    }

    synchronized JobHandle handle(JobId id) {
        require(id);
        return handles.get(id);
    }

    /**
     * @param filter status to keep, or null for all
     * @return record copies, newest submission first
     */
    List<JobRecord> snapshots(JobStatus filter) {
        List<JobRecord> copies = new ArrayList<>();
        synchronized (this) {
            for (JobRecord record : records.values()) {
                if (filter == null || record.getStatus() == filter) {
                    copies.add(record.copy());
                }
            }
        }
        copies.sort(NEWEST_FIRST);
        return copies;
    }

    synchronized Object result(JobId id) {
        JobRecord record = require(id);
        switch (record.getStatus()) {
            case COMPLETED:
                return results.get(id);
            case FAILED:
                throw new JobFailureException(id, record.getError(), record.getErrorTraceback());
            case CANCELED:
                throw new JobSchedulerException(ErrorKind.NOT_FINISHED, id, "Job " + id + " was canceled");
            default:
                throw new JobSchedulerException(ErrorKind.NOT_FINISHED, id,
                    "Job " + id + " not finished (status=" + record.getStatus().wireName() + ")");
        }
    }

    synchronized Map<JobStatus, Integer> countByStatus() {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }
        for (JobRecord record : records.values()) {
            counts.merge(record.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    synchronized List<JobHandle> activeHandles() {
        List<JobHandle> active = new ArrayList<>();
        for (Map.Entry<JobId, JobRecord> entry : records.entrySet()) {
            if (!entry.getValue().getStatus().isTerminal()) {
                active.add(handles.get(entry.getKey()));
            }
        }
        return active;
    }

    /**
     * @return true if the job was registered and is now gone
     */
    synchronized boolean remove(JobId id) {
        handles.remove(id);
        results.remove(id);
        return records.remove(id) != null;
    }

    // ==================== WORKER TRANSITIONS ====================
    // Each returns a copy of the updated record, or null when the job is gone
    // or the transition no longer applies.

    synchronized JobRecord markRunning(JobId id, Instant at) {
        JobRecord record = records.get(id);
        if (record == null || record.getStatus() != JobStatus.PENDING) {
            return null;
        }
        record.markRunning(at);
        return record.copy();
    }

    synchronized JobRecord markCompleted(JobId id, Instant at, Object value) {
        JobRecord record = records.get(id);
        if (record == null || record.getStatus() != JobStatus.RUNNING) {
            return null;
        }
        JobId artifactId = value instanceof JobId ? (JobId) value : null;
        record.markCompleted(at, artifactId);
        results.put(id, value);
        return record.copy();
    }

    synchronized JobRecord markFailed(JobId id, Instant at, String error, String errorTraceback) {
        JobRecord record = records.get(id);
        if (record == null || record.getStatus() != JobStatus.RUNNING) {
            return null;
        }
        record.markFailed(at, error, errorTraceback);
        return record.copy();
    }

    synchronized JobRecord markCanceled(JobId id, Instant at) {
        JobRecord record = records.get(id);
        if (record == null || record.getStatus().isTerminal()) {
            return null;
        }
        record.markCanceled(at);
        return record.copy();
    }

    private JobRecord require(JobId id) {
        JobRecord record = records.get(id);
        if (record == null) {
            throw JobSchedulerException.notFound(id);
        }
        return record;
    }
}
