package com.jobscheduler.app;

import com.jobscheduler.core.ErrorKind;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobRecord;
import com.jobscheduler.core.JobScheduler;
import com.jobscheduler.core.JobSchedulerException;
import com.jobscheduler.core.JobStatus;
import org.json.JSONObject;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Push-style view of a job built on the scheduler's pull API.
 *
 * <p>Polls {@link JobScheduler#getRecord(JobId)} at a fixed interval and forwards
 * every record to a sink as a Server-Sent-Events frame ({@code data: <json>\n\n}),
 * stopping after the first terminal record. If the job is deleted while streaming,
 * a final {@code data: {"status":"deleted"}} frame is sent.</p>
 *
 * <pre>{@code
 * JobStatusStream stream = new JobStatusStream(scheduler, poller, Duration.ofMillis(500));
 * stream.open(jobId, frame -> response.write(frame)).thenAccept(status -> response.close());
 * }</pre>
 *
 * @author Job Scheduler Team
 * @see JobRecordJson
 */
public class JobStatusStream {
    private static final Logger logger = Logger.getLogger(JobStatusStream.class.getName());

    static final String DELETED_EVENT = formatEvent(new JSONObject().put("status", "deleted").toString());

    private final JobScheduler scheduler;
    private final ScheduledExecutorService poller;
    private final Duration pollInterval;

    /**
     * @param scheduler scheduler to observe
     * @param poller executor running the polling loop
     * @param pollInterval delay between polls, at least one millisecond
     * @throws IllegalArgumentException if the interval is shorter than one millisecond
     */
    public JobStatusStream(JobScheduler scheduler, ScheduledExecutorService poller, Duration pollInterval) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.poller = Objects.requireNonNull(poller, "poller");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.toMillis() < 1) {
            throw new IllegalArgumentException("pollInterval must be at least 1ms, got " + pollInterval);
        }
    }

    /**
     * Start streaming a job's records to the sink.
     *
     * @param jobId job to observe
     * @param sink receives SSE frames, from the poller thread
     * @return future completing with the terminal status, or null if the job was
     *         deleted. Cancelling it stops the stream.
     * @throws JobSchedulerException NOT_FOUND if the job does not exist
     */
    public CompletableFuture<JobStatus> open(JobId jobId, Consumer<String> sink) {
        scheduler.getRecord(jobId); // fail fast for unknown ids

        CompletableFuture<JobStatus> done = new CompletableFuture<>();
        ScheduledFuture<?> polling = poller.scheduleWithFixedDelay(
            () -> poll(jobId, sink, done), 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        done.whenComplete((status, error) -> polling.cancel(false));
        return done;
    }

    private void poll(JobId jobId, Consumer<String> sink, CompletableFuture<JobStatus> done) {
        if (done.isDone()) {
            return;
        }
        try {
            JobRecord record = scheduler.getRecord(jobId);
            sink.accept(formatEvent(JobRecordJson.toJson(record)));
            if (record.getStatus().isTerminal()) {
                done.complete(record.getStatus());
            }
        } catch (JobSchedulerException e) {
            if (e.getKind() != ErrorKind.NOT_FOUND) {
                done.completeExceptionally(e);
                return;
            }
            sink.accept(DELETED_EVENT);
            done.complete(null);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Status stream for job " + jobId + " aborted", e);
            done.completeExceptionally(e);
        }
    }

    /**
     * @param data event payload, a single line
     * @return the SSE frame
     */
    static String formatEvent(String data) {
        return "data: " + data + "\n\n";
    }
}
