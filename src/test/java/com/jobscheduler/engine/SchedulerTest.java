package com.jobscheduler.engine;

import com.jobscheduler.core.ErrorKind;
import com.jobscheduler.core.JobArguments;
import com.jobscheduler.core.JobFailureException;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobRecord;
import com.jobscheduler.core.JobSchedulerException;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.core.JobTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the in-memory scheduler.
 *
 * Tests cover:
 * - Submission, completion and result retrieval for every target shape
 * - Failure capture and re-surfacing through getResult
 * - Cancellation of running and pending jobs, deletion
 * - Concurrency ceiling, including runtime reconfiguration
 * - Timed waits that never cancel the job
 * - Record ordering and shutdown
 * - Deferred jobs cancelled or deleted before and after they start
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class SchedulerTest {

    private Scheduler scheduler;

    @BeforeEach
    public void setUp() {
        scheduler = new Scheduler(SchedulerConfig.builder()
            .name("test")
            .workerThreads(8)
            .shutdownTimeout(Duration.ofSeconds(5))
            .build());
    }

    @AfterEach
    public void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    /**
     * Test 1: a submitted job is visible immediately, as PENDING or RUNNING.
     */
    @Test
    @Order(1)
    public void testSubmittedJobIsImmediatelyVisible() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<JobId> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ids.add(scheduler.addJob(JobTarget.ofCallable(() -> {
                release.await();
                return "done";
            })));
        }

        for (JobId id : ids) {
            JobRecord record = scheduler.getRecord(id);
            assertTrue(record.getStatus() == JobStatus.PENDING || record.getStatus() == JobStatus.RUNNING,
                "Unexpected status " + record.getStatus());
            assertNotNull(record.getSubmittedAt());
            assertNull(record.getFinishedAt());
        }

        release.countDown();
        for (JobId id : ids) {
            scheduler.await(id, Duration.ofSeconds(5));
            assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id));
        }
    }

    /**
     * Test 2: a synchronous job completes and getResult returns exactly its value.
     */
    @Test
    @Order(2)
    public void testSyncJobCompletesWithResult() throws Exception {
        JobId id = scheduler.addJob(
            JobTarget.of((context, args) -> args.get(0, Integer.class) + args.get("plus", Integer.class)),
            JobArguments.builder().add(40).put("plus", 2).build());

        scheduler.await(id, Duration.ofSeconds(5));

        assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id));
        assertEquals(42, scheduler.getResult(id, Integer.class));

        JobRecord record = scheduler.getRecord(id);
        assertNotNull(record.getStartedAt());
        assertNotNull(record.getFinishedAt());
        assertFalse(record.getStartedAt().isBefore(record.getSubmittedAt()));
        assertFalse(record.getFinishedAt().isBefore(record.getStartedAt()));
        assertNull(record.getError());
        assertNull(record.getArtifactId());
    }

    /**
     * Test 3: an exception in the body fails the job; getResult re-surfaces it.
     */
    @Test
    @Order(3)
    public void testFailingJobCapturesError() throws Exception {
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> {
            throw new IllegalArgumentException("boom");
        }));

        scheduler.await(id, Duration.ofSeconds(5));

        JobRecord record = scheduler.getRecord(id);
        assertEquals(JobStatus.FAILED, record.getStatus());
        assertEquals("IllegalArgumentException: boom", record.getError());
        assertNotNull(record.getErrorTraceback());
        assertFalse(record.getErrorTraceback().isEmpty());
        assertTrue(record.getErrorTraceback().contains("IllegalArgumentException"));
        assertNotNull(record.getFinishedAt());

        JobFailureException e = assertThrows(JobFailureException.class, () -> scheduler.getResult(id));
        assertEquals(ErrorKind.JOB_FAILURE, e.getKind());
        assertTrue(e.getMessage().contains("IllegalArgumentException"));
        assertTrue(e.getMessage().contains("boom"));
        assertEquals(record.getErrorTraceback(), e.getErrorTraceback());
    }

    /**
     * Test 4: cancel on a running job returns true and records CANCELED.
     */
    @Test
    @Order(4)
    public void testCancelRunningJob() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> {
            started.countDown();
            Thread.sleep(30_000);
            return "finished";
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.RUNNING, scheduler.getStatus(id));

        assertTrue(scheduler.cancel(id));

        JobRecord record = scheduler.getRecord(id);
        assertEquals(JobStatus.CANCELED, record.getStatus());
        assertNotNull(record.getFinishedAt());
        assertNull(record.getError());
        assertNull(record.getErrorTraceback());

        JobSchedulerException e = assertThrows(JobSchedulerException.class, () -> scheduler.getResult(id));
        assertEquals(ErrorKind.NOT_FINISHED, e.getKind());
    }

    /**
     * Test 5: a body polling its context observes cancellation cooperatively.
     */
    @Test
    @Order(5)
    public void testCooperativeCancellationViaContext() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger iterations = new AtomicInteger();
        JobId id = scheduler.addJob(JobTarget.of((context, args) -> {
            started.countDown();
            while (true) {
                context.throwIfCancelled();
                iterations.incrementAndGet();
                Thread.onSpinWait();
            }
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(scheduler.cancel(id));
        assertEquals(JobStatus.CANCELED, scheduler.getStatus(id));
        assertTrue(iterations.get() > 0);
    }

    /**
     * Test 6: cancel on a completed job returns false and changes nothing.
     */
    @Test
    @Order(6)
    public void testCancelCompletedJobReturnsFalse() throws Exception {
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> "value"));
        scheduler.await(id, Duration.ofSeconds(5));
        JobRecord before = scheduler.getRecord(id);

        assertFalse(scheduler.cancel(id));

        JobRecord after = scheduler.getRecord(id);
        assertEquals(JobStatus.COMPLETED, after.getStatus());
        assertEquals(before.getFinishedAt(), after.getFinishedAt());
        assertEquals("value", scheduler.getResult(id));
    }

    /**
     * Test 7: a job cancelled while waiting for a permit never runs.
     */
    @Test
    @Order(7)
    public void testCancelPendingJobNeverRunsBody() throws Exception {
        scheduler.setMaxConcurrency(1);
        CountDownLatch release = new CountDownLatch(1);
        JobId blocker = scheduler.addJob(JobTarget.ofCallable(() -> {
            release.await();
            return null;
        }));
        AtomicBoolean ran = new AtomicBoolean(false);
        JobId queued = scheduler.addJob(JobTarget.ofCallable(() -> ran.getAndSet(true)));

        waitUntil(() -> scheduler.getStatus(blocker) == JobStatus.RUNNING, Duration.ofSeconds(5));
        assertEquals(JobStatus.PENDING, scheduler.getStatus(queued));

        assertTrue(scheduler.cancel(queued));

        JobRecord record = scheduler.getRecord(queued);
        assertEquals(JobStatus.CANCELED, record.getStatus());
        assertNull(record.getStartedAt());
        assertNotNull(record.getFinishedAt());

        release.countDown();
        scheduler.await(blocker, Duration.ofSeconds(5));
        assertFalse(ran.get());
    }

    /**
     * Test 8: delete works on pending, running and terminal jobs.
     */
    @Test
    @Order(8)
    public void testDeleteInEveryState() throws Exception {
        scheduler.setMaxConcurrency(1);
        CountDownLatch started = new CountDownLatch(1);
        JobId running = scheduler.addJob(JobTarget.ofCallable(() -> {
            started.countDown();
            Thread.sleep(30_000);
            return null;
        }));
        JobId pending = scheduler.addJob(JobTarget.ofCallable(() -> "never"));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        scheduler.delete(pending);
        scheduler.delete(running);

        JobId finished = scheduler.addJob(JobTarget.ofCallable(() -> "done"));
        scheduler.await(finished, Duration.ofSeconds(5));
        scheduler.delete(finished);

        for (JobId id : List.of(pending, running, finished)) {
            JobSchedulerException e = assertThrows(JobSchedulerException.class, () -> scheduler.getRecord(id));
            assertEquals(ErrorKind.NOT_FOUND, e.getKind());
            assertEquals(id, e.getJobId());
        }
        assertTrue(scheduler.getAllRecords().isEmpty());

        JobSchedulerException again = assertThrows(JobSchedulerException.class, () -> scheduler.delete(finished));
        assertEquals(ErrorKind.NOT_FOUND, again.getKind());
    }

    /**
     * Test 9: with max concurrency 2, six blocking jobs never run more than two at a time.
     */
    @Test
    @Order(9)
    public void testConcurrencyCeiling() throws Exception {
        scheduler.setMaxConcurrency(2);
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        List<JobId> ids = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            ids.add(scheduler.addJob(JobTarget.ofCallable(() -> {
                int now = current.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    release.await();
                } finally {
                    current.decrementAndGet();
                }
                return now;
            })));
        }

        waitUntil(() -> current.get() == 2, Duration.ofSeconds(5));
        Thread.sleep(200); // give an over-eager scheduler the chance to misbehave
        assertEquals(2, scheduler.getRunningCount());
        assertEquals(4, scheduler.getAllRecords(JobStatus.PENDING).size());

        release.countDown();
        for (JobId id : ids) {
            scheduler.await(id, Duration.ofSeconds(5));
            assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id));
        }
        assertTrue(peak.get() <= 2, "Peak concurrency was " + peak.get());
        assertEquals(2, peak.get());
    }

    /**
     * Test 10: raising the ceiling lets new jobs start while old permits are still held.
     */
    @Test
    @Order(10)
    public void testSetMaxConcurrencyAtRuntime() throws Exception {
        scheduler.setMaxConcurrency(1);
        assertEquals(1, scheduler.getMaxConcurrency());

        CountDownLatch release = new CountDownLatch(1);
        JobId first = scheduler.addJob(JobTarget.ofCallable(() -> {
            release.await();
            return "first";
        }));
        waitUntil(() -> scheduler.getStatus(first) == JobStatus.RUNNING, Duration.ofSeconds(5));

        scheduler.setMaxConcurrency(null);
        assertNull(scheduler.getMaxConcurrency());

        JobId second = scheduler.addJob(JobTarget.ofCallable(() -> "second"));
        scheduler.await(second, Duration.ofSeconds(5));
        assertEquals(JobStatus.COMPLETED, scheduler.getStatus(second));
        assertEquals(JobStatus.RUNNING, scheduler.getStatus(first));

        release.countDown();
        scheduler.await(first, Duration.ofSeconds(5));
        assertEquals("first", scheduler.getResult(first));
    }

    /**
     * Test 11: an expired wait raises TIMEOUT without affecting the job.
     */
    @Test
    @Order(11)
    public void testWaitTimeoutDoesNotCancelJob() throws Exception {
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> {
            Thread.sleep(1000);
            return "slow";
        }));

        JobSchedulerException e = assertThrows(JobSchedulerException.class,
            () -> scheduler.await(id, Duration.ofMillis(10)));
        assertEquals(ErrorKind.TIMEOUT, e.getKind());
        assertFalse(scheduler.getStatus(id).isTerminal());

        scheduler.await(id);
        assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id));
        assertEquals("slow", scheduler.getResult(id));
    }

    /**
     * Test 12: abandoning a non-blocking observer leaves the job alone.
     */
    @Test
    @Order(12)
    public void testCancellingObserverDoesNotCancelJob() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> {
            release.await();
            return "kept";
        }));

        CompletableFuture<JobRecord> observer = scheduler.whenDone(id);
        observer.cancel(true);
        release.countDown();

        JobRecord terminal = scheduler.whenDone(id).get(5, TimeUnit.SECONDS);
        assertEquals(JobStatus.COMPLETED, terminal.getStatus());
        assertEquals("kept", scheduler.getResult(id));
    }

    /**
     * Test 13: records are listed newest submission first.
     */
    @Test
    @Order(13)
    public void testRecordsNewestFirst() throws Exception {
        JobId a = scheduler.addJob(JobTarget.ofCallable(() -> "a"));
        JobId b = scheduler.addJob(JobTarget.ofCallable(() -> "b"));
        JobId c = scheduler.addJob(JobTarget.ofCallable(() -> "c"));

        List<JobId> listed = new ArrayList<>();
        for (JobRecord record : scheduler.getAllRecords()) {
            listed.add(record.getId());
        }
        assertEquals(List.of(c, b, a), listed);

        // Completion order does not change the listing
        scheduler.await(a, Duration.ofSeconds(5));
        scheduler.await(b, Duration.ofSeconds(5));
        scheduler.await(c, Duration.ofSeconds(5));
        assertEquals(c, scheduler.getAllRecords().get(0).getId());
        assertEquals(3, scheduler.getAllRecords(JobStatus.COMPLETED).size());
        assertTrue(scheduler.getAllRecords(JobStatus.FAILED).isEmpty());
    }

    /**
     * Test 14: async and deferred targets complete; a returned JobId becomes the artifact id.
     */
    @Test
    @Order(14)
    public void testAsyncAndDeferredTargets() throws Exception {
        JobId async = scheduler.addJob(
            JobTarget.async((context, args) -> CompletableFuture.supplyAsync(() -> "hello " + args.get("name"))),
            JobArguments.builder().put("name", "world").build());

        JobId artifact = JobId.generate();
        JobId deferred = scheduler.addJob(JobTarget.deferred(CompletableFuture.completedFuture(artifact)));

        scheduler.await(async, Duration.ofSeconds(5));
        scheduler.await(deferred, Duration.ofSeconds(5));

        assertEquals("hello world", scheduler.getResult(async));
        assertEquals(artifact, scheduler.getResult(deferred));
        assertEquals(artifact, scheduler.getRecord(deferred).getArtifactId());
        assertNull(scheduler.getRecord(async).getArtifactId());
    }

    /**
     * Test 15: a deferred computation with arguments is rejected at submission.
     */
    @Test
    @Order(15)
    public void testDeferredWithArgumentsRejectedSynchronously() {
        JobSchedulerException e = assertThrows(JobSchedulerException.class,
            () -> scheduler.addJob(JobTarget.deferred(CompletableFuture.completedFuture(1)), JobArguments.of("x")));

        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
        assertTrue(scheduler.getAllRecords().isEmpty());
    }

    /**
     * Test 16: cancelling an async job cancels the stage it returned.
     */
    @Test
    @Order(16)
    public void testCancelAsyncJob() throws Exception {
        CompletableFuture<String> never = new CompletableFuture<>();
        JobId id = scheduler.addJob(JobTarget.async((context, args) -> never));
        waitUntil(() -> scheduler.getStatus(id) == JobStatus.RUNNING, Duration.ofSeconds(5));

        assertTrue(scheduler.cancel(id));

        assertEquals(JobStatus.CANCELED, scheduler.getStatus(id));
        assertTrue(never.isCancelled());
    }

    /**
     * Test 17: errors for unknown ids and unfinished jobs.
     */
    @Test
    @Order(17)
    public void testLookupErrors() throws Exception {
        JobId unknown = JobId.generate();
        assertEquals(ErrorKind.NOT_FOUND,
            assertThrows(JobSchedulerException.class, () -> scheduler.getStatus(unknown)).getKind());
        assertEquals(ErrorKind.NOT_FOUND,
            assertThrows(JobSchedulerException.class, () -> scheduler.getResult(unknown)).getKind());
        assertEquals(ErrorKind.NOT_FOUND,
            assertThrows(JobSchedulerException.class, () -> scheduler.cancel(unknown)).getKind());
        assertEquals(ErrorKind.NOT_FOUND,
            assertThrows(JobSchedulerException.class, () -> scheduler.await(unknown)).getKind());

        CountDownLatch release = new CountDownLatch(1);
        JobId running = scheduler.addJob(JobTarget.ofCallable(() -> {
            release.await();
            return null;
        }));
        JobSchedulerException notFinished = assertThrows(JobSchedulerException.class,
            () -> scheduler.getResult(running));
        assertEquals(ErrorKind.NOT_FINISHED, notFinished.getKind());

        release.countDown();
        scheduler.await(running, Duration.ofSeconds(5));
        assertNull(scheduler.getResult(running));
    }

    /**
     * Test 18: returned records are snapshots, unaffected by later transitions.
     */
    @Test
    @Order(18)
    public void testRecordsAreSnapshots() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> {
            release.await();
            return "x";
        }));
        JobRecord snapshot = scheduler.getRecord(id);

        release.countDown();
        scheduler.await(id, Duration.ofSeconds(5));

        assertNull(snapshot.getFinishedAt());
        assertNotEquals(JobStatus.COMPLETED, snapshot.getStatus());
        assertEquals(JobStatus.COMPLETED, scheduler.getRecord(id).getStatus());
    }

    /**
     * Test 19: stats report counts per status and limiter state.
     */
    @Test
    @Order(19)
    public void testStats() throws Exception {
        scheduler.setMaxConcurrency(3);
        JobId ok = scheduler.addJob(JobTarget.ofCallable(() -> 1));
        JobId bad = scheduler.addJob(JobTarget.ofCallable(() -> {
            throw new IllegalStateException("nope");
        }));
        scheduler.await(ok, Duration.ofSeconds(5));
        scheduler.await(bad, Duration.ofSeconds(5));

        Map<String, Object> stats = scheduler.getStats();
        assertEquals("test", stats.get("name"));
        assertEquals(3, stats.get("maxConcurrency"));
        assertEquals(1, stats.get("completed"));
        assertEquals(1, stats.get("failed"));
        assertEquals(0, stats.get("running"));
        assertEquals(2, stats.get("total"));
        assertEquals(false, stats.get("shutdown"));
    }

    /**
     * Test 20: shutdown cancels active jobs and rejects new ones.
     */
    @Test
    @Order(20)
    public void testShutdown() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> {
            started.countDown();
            Thread.sleep(30_000);
            return null;
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        scheduler.shutdown();

        assertTrue(scheduler.isShutdown());
        scheduler.await(id, Duration.ofSeconds(5));
        assertEquals(JobStatus.CANCELED, scheduler.getStatus(id));
        assertThrows(IllegalStateException.class, () -> scheduler.addJob(JobTarget.ofCallable(() -> 1)));
    }

    /**
     * Test 21: cancelling a deferred job while it waits for a permit cancels its stage.
     */
    @Test
    @Order(21)
    public void testCancelPendingDeferredJobCancelsStage() throws Exception {
        scheduler.setMaxConcurrency(1);
        CountDownLatch release = new CountDownLatch(1);
        JobId blocker = scheduler.addJob(JobTarget.ofCallable(() -> {
            release.await();
            return null;
        }));
        CompletableFuture<String> stage = new CompletableFuture<>();
        JobId deferred = scheduler.addJob(JobTarget.deferred(stage));
        waitUntil(() -> scheduler.getStatus(blocker) == JobStatus.RUNNING, Duration.ofSeconds(5));
        assertEquals(JobStatus.PENDING, scheduler.getStatus(deferred));

        assertTrue(scheduler.cancel(deferred));

        assertEquals(JobStatus.CANCELED, scheduler.getStatus(deferred));
        assertNull(scheduler.getRecord(deferred).getStartedAt());
        assertTrue(stage.isCancelled());

        release.countDown();
        scheduler.await(blocker, Duration.ofSeconds(5));
    }

    /**
     * Test 22: deleting a pending deferred job cancels its stage and removes the record.
     */
    @Test
    @Order(22)
    public void testDeletePendingDeferredJobCancelsStage() throws Exception {
        scheduler.setMaxConcurrency(1);
        CountDownLatch release = new CountDownLatch(1);
        JobId blocker = scheduler.addJob(JobTarget.ofCallable(() -> {
            release.await();
            return null;
        }));
        CompletableFuture<String> stage = new CompletableFuture<>();
        JobId deferred = scheduler.addJob(JobTarget.deferred(stage));
        waitUntil(() -> scheduler.getStatus(blocker) == JobStatus.RUNNING, Duration.ofSeconds(5));

        scheduler.delete(deferred);

        assertTrue(stage.isCancelled());
        assertEquals(ErrorKind.NOT_FOUND,
            assertThrows(JobSchedulerException.class, () -> scheduler.getRecord(deferred)).getKind());

        release.countDown();
        scheduler.await(blocker, Duration.ofSeconds(5));
    }

    /**
     * Test 23: cancelling and deleting running deferred jobs cancels their stages.
     */
    @Test
    @Order(23)
    public void testCancelAndDeleteRunningDeferredJob() throws Exception {
        CompletableFuture<String> cancelledStage = new CompletableFuture<>();
        CompletableFuture<String> deletedStage = new CompletableFuture<>();
        JobId cancelled = scheduler.addJob(JobTarget.deferred(cancelledStage));
        JobId deleted = scheduler.addJob(JobTarget.deferred(deletedStage));
        waitUntil(() -> scheduler.getStatus(cancelled) == JobStatus.RUNNING
            && scheduler.getStatus(deleted) == JobStatus.RUNNING, Duration.ofSeconds(5));

        assertTrue(scheduler.cancel(cancelled));
        scheduler.delete(deleted);

        JobRecord record = scheduler.getRecord(cancelled);
        assertEquals(JobStatus.CANCELED, record.getStatus());
        assertNotNull(record.getStartedAt());
        assertTrue(cancelledStage.isCancelled());
        assertTrue(deletedStage.isCancelled());
        assertEquals(1, scheduler.getAllRecords().size());
    }

    /**
     * Test 24: a body that finishes normally despite the request is not reported as cancelled.
     */
    @Test
    @Order(24)
    public void testCancelReturnsFalseWhenJobFinishesOnItsOwn() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        JobId id = scheduler.addJob(JobTarget.ofCallable(() -> {
            started.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                return "stopped early";
            }
            return "slept";
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertFalse(scheduler.cancel(id));

        assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id));
        assertEquals("stopped early", scheduler.getResult(id));
    }

    /**
     * Test 25: changing the ceiling while jobs are being submitted loses no job and leaks no permit.
     */
    @Test
    @Order(25)
    public void testSetMaxConcurrencyWhileSubmitting() throws Exception {
        int submitters = 4;
        int jobsPerSubmitter = 25;
        Queue<JobId> ids = new ConcurrentLinkedQueue<>();
        AtomicBoolean submitting = new AtomicBoolean(true);
        ExecutorService clients = Executors.newFixedThreadPool(submitters + 1);

        try {
            Future<?> swapper = clients.submit(() -> {
                Integer[] ceilings = {1, 2, 3, null};
                int i = 0;
                while (submitting.get()) {
                    scheduler.setMaxConcurrency(ceilings[i++ % ceilings.length]);
                    Thread.yield();
                }
            });

            List<Future<?>> submissions = new ArrayList<>();
            for (int s = 0; s < submitters; s++) {
                submissions.add(clients.submit(() -> {
                    for (int j = 0; j < jobsPerSubmitter; j++) {
                        ids.add(scheduler.addJob(JobTarget.ofCallable(() -> {
                            Thread.sleep(1);
                            return "ok";
                        })));
                    }
                }));
            }
            for (Future<?> submission : submissions) {
                submission.get(10, TimeUnit.SECONDS);
            }
            submitting.set(false);
            swapper.get(5, TimeUnit.SECONDS);
        } finally {
            submitting.set(false);
            clients.shutdownNow();
        }

        assertEquals(submitters * jobsPerSubmitter, ids.size());
        for (JobId id : ids) {
            scheduler.await(id, Duration.ofSeconds(10));
            assertEquals(JobStatus.COMPLETED, scheduler.getStatus(id));
        }

        Map<String, Object> stats = scheduler.getStats();
        assertEquals(0, stats.get("activePermits"));
        assertEquals(0, stats.get("waitingForPermit"));
        assertEquals(0, scheduler.getRunningCount());
    }

    private static void waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout.toMillis() + "ms");
            }
            Thread.sleep(10);
        }
    }
}
