package com.jobscheduler.app;

import com.jobscheduler.core.JobArguments;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobRecord;
import com.jobscheduler.core.JobSchedulerException;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.core.JobTarget;
import com.jobscheduler.engine.Scheduler;
import com.jobscheduler.engine.SchedulerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Demo entry point: submits a handful of jobs of every shape, streams one of
 * them, cancels another, and prints the final records as JSON.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Job Scheduler Demo Starting ===");

        try {
            List<JobRecord> records = run(SchedulerConfig.load());
            System.out.println(JobRecordJson.toJson(records));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Demo interrupted");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error in demo", e);
            System.exit(1);
        }
    }

    /**
     * Run the demo against a fresh scheduler.
     *
     * @param config scheduler settings
     * @return final records of all demo jobs, newest first
     * @throws InterruptedException if interrupted while waiting for jobs
     */
    static List<JobRecord> run(SchedulerConfig config) throws InterruptedException {
        ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor();
        try (Scheduler scheduler = new Scheduler(config)) {
            List<JobId> ids = new ArrayList<>();

            // Synchronous callable with bound arguments
            ids.add(scheduler.addJob(
                JobTarget.of((context, arguments) -> {
                    int from = arguments.get(0, Integer.class);
                    int to = arguments.get(1, Integer.class);
                    long sum = 0;
                    for (int i = from; i <= to; i++) {
                        context.throwIfCancelled();
                        sum += i;
                    }
                    context.log(Level.INFO, "sum of " + from + ".." + to + " is " + sum);
                    return sum;
                }),
                JobArguments.of(1, 1_000)));

            // Asynchronous callable
            ids.add(scheduler.addJob(JobTarget.async((context, arguments) ->
                CompletableFuture.supplyAsync(() -> "hello " + arguments.get("name"),
                    CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS))),
                JobArguments.builder().put("name", "scheduler").build()));

            // Pre-built deferred computation returning a correlation id
            ids.add(scheduler.addJob(JobTarget.deferred(
                CompletableFuture.supplyAsync(JobId::generate))));

            // Failing job
            ids.add(scheduler.addJob(JobTarget.ofCallable(() -> {
                throw new IllegalStateException("demo failure");
            })));

            // Long job that will be cancelled
            JobId sleeper = scheduler.addJob(JobTarget.ofCallable(() -> {
                Thread.sleep(60_000);
                return "unreachable";
            }));
            ids.add(sleeper);

            JobStatusStream stream = new JobStatusStream(scheduler, poller, config.getStreamPollInterval());
            CompletableFuture<JobStatus> streamed = stream.open(ids.get(1), frame -> logger.info("stream " + frame.trim()));

            for (JobId id : ids) {
                if (!id.equals(sleeper)) {
                    scheduler.await(id, Duration.ofSeconds(10));
                }
            }
            logger.info("Cancelled sleeper: " + scheduler.cancel(sleeper));
            logger.info("Streamed job ended as " + streamed.join());

            for (JobId id : ids) {
                try {
                    logger.info("Result of " + id + ": " + scheduler.getResult(id));
                } catch (JobSchedulerException e) {
                    logger.info("No result for " + id + " (" + e.getKind() + "): " + e.getMessage());
                }
            }
            logger.info("Stats: " + scheduler.getStats());
            return scheduler.getAllRecords();
        } finally {
            poller.shutdownNow();
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties", e);
        }
    }
}
