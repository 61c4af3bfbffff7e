package com.jobscheduler.engine;

import com.jobscheduler.core.ErrorKind;
import com.jobscheduler.core.JobArguments;
import com.jobscheduler.core.JobContext;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobRecord;
import com.jobscheduler.core.JobScheduler;
import com.jobscheduler.core.JobSchedulerException;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.core.JobTarget;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link JobScheduler}: runs jobs in this process under a
 * configurable concurrency ceiling.
 *
 * <p><b>Key Responsibilities:</b></p>
 * <ul>
 *   <li>Assign each submitted job a fresh {@link JobId} and a PENDING record</li>
 *   <li>Hand the normalized body to a {@link Worker}, which waits for a
 *       {@link ConcurrencyLimiter} permit and drives the state machine</li>
 *   <li>Serve point-in-time record copies, results and captured failures</li>
 *   <li>Cooperative cancellation, deletion, and timed waits that never cancel the job</li>
 * </ul>
 *
 * <p><b>Threads:</b></p>
 * <ul>
 *   <li>{@code <name>-dispatcher}: a single thread that starts job bodies, so
 *       {@link #addJob} always returns before the body runs. Asynchronous job
 *       functions are invoked here and must return their stage promptly.</li>
 *   <li>{@code <name>-worker-N}: fixed pool running synchronous bodies.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> all job state lives in a {@link JobRegistry} whose monitor
 * is the single guard for records, results and handles. The active limiter is
 * swapped under the same guard. Blocking calls ({@link #cancel}, {@link #delete},
 * {@link #await}) must not be made from inside an asynchronous job function, which
 * runs on the dispatcher thread.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * try (Scheduler scheduler = new Scheduler(SchedulerConfig.builder().maxConcurrency(4).build())) {
 *     JobId id = scheduler.addJob(JobTarget.of((ctx, args) -> compute(args.get(0, Integer.class))),
 *                                 JobArguments.of(42));
 *     scheduler.await(id, Duration.ofSeconds(10));
 *     Object result = scheduler.getResult(id);
 * }
 * }</pre>
 *
 * @author Job Scheduler Team
 * @see Worker
 * @see JobExecutor
 */
public class Scheduler implements JobScheduler, AutoCloseable {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final SchedulerConfig config;
    private final JobRegistry registry;          // single guard for job state
    private final ExecutorService workerPool;    // runs synchronous bodies
    private final ExecutorService dispatcher;    // starts bodies off the caller's thread
    private final JobExecutor jobExecutor;
    private final AtomicBoolean shutdown;
    private ConcurrencyLimiter limiter;          // guarded by registry

    /**
     * Create a scheduler with default settings (unbounded concurrency).
     */
    public Scheduler() {
        this(SchedulerConfig.defaults());
    }

    /**
     * Create a scheduler from the given settings.
     *
     * @param config scheduler settings
     */
    public Scheduler(SchedulerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = new JobRegistry();
        this.workerPool = Executors.newFixedThreadPool(config.getWorkerThreads(),
            new NamedThreadFactory(config.getName() + "-worker"));
        this.dispatcher = Executors.newSingleThreadExecutor(
            new NamedThreadFactory(config.getName() + "-dispatcher"));
        this.jobExecutor = new JobExecutor(workerPool);
        this.shutdown = new AtomicBoolean(false);
        this.limiter = new ConcurrencyLimiter(config.getMaxConcurrency());

        logger.info("Scheduler '" + config.getName() + "' initialized with " + config.getWorkerThreads()
            + " workers, max concurrency " + describe(config.getMaxConcurrency()));
    }

    // ==================== SUBMISSION ====================

    @Override
    public JobId addJob(JobTarget target, JobArguments arguments) {
        Objects.requireNonNull(target, "target");
        if (shutdown.get()) {
            throw new IllegalStateException("Scheduler '" + config.getName() + "' is shut down");
        }

        JobId id = JobId.generate();
        // Validates target/arguments pairing before anything is registered
        JobThunk thunk = jobExecutor.prepare(id, target, arguments);

        JobHandle handle = new JobHandle(new JobContext(id));
        Worker worker;
        synchronized (registry) {
            registry.register(new JobRecord(id, Instant.now()), handle);
            worker = new Worker(id, thunk, handle, registry, limiter, dispatcher);
        }

        worker.start();
        logger.fine("Job submitted: " + id + " (" + target.getKind() + ")");
        return id;
    }

    // ==================== QUERIES ====================

    @Override
    public JobStatus getStatus(JobId jobId) {
        return registry.status(jobId);
    }

    @Override
    public JobRecord getRecord(JobId jobId) {
        return registry.snapshot(jobId);
    }

    @Override
    public List<JobRecord> getAllRecords() {
        return registry.snapshots(null);
    }

    @Override
    public List<JobRecord> getAllRecords(JobStatus status) {
        return registry.snapshots(Objects.requireNonNull(status, "status"));
    }

    @Override
    public Object getResult(JobId jobId) {
        return registry.result(jobId);
    }

    // ==================== CANCELLATION & DELETION ====================

    @Override
    public boolean cancel(JobId jobId) {
        JobHandle handle = registry.handle(jobId);
        if (registry.status(jobId).isTerminal()) {
            return false;
        }

        if (handle.getContext().cancel()) {
            logger.info("Cancellation requested for job " + jobId);
        }
        // Cooperative: the job may still finish on its own before it observes the request
        JobRecord terminal = handle.awaitDone();
        return terminal != null && terminal.getStatus() == JobStatus.CANCELED;
    }

    @Override
    public void delete(JobId jobId) {
        JobHandle handle = registry.handle(jobId);
        if (!registry.status(jobId).isTerminal()) {
            handle.getContext().cancel();
            handle.awaitDone();
        }

        if (registry.remove(jobId)) {
            logger.info("Job deleted: " + jobId);
        }
    }

    // ==================== WAITING ====================

    @Override
    public void await(JobId jobId) throws InterruptedException {
        await(jobId, null);
    }

    @Override
    public void await(JobId jobId, Duration timeout) throws InterruptedException {
        // A copy: timing out or abandoning this wait cannot touch the job itself
        CompletableFuture<JobRecord> observer = registry.handle(jobId).observe();
        try {
            if (timeout == null) {
                observer.get();
            } else {
                observer.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            throw new JobSchedulerException(ErrorKind.TIMEOUT, jobId,
                "Timed out after " + timeout.toMillis() + "ms waiting for job " + jobId, e);
        } catch (ExecutionException e) {
            // The completion signal is only ever completed normally
            throw new IllegalStateException("Completion signal of job " + jobId + " failed", e.getCause());
        }
    }

    @Override
    public CompletableFuture<JobRecord> whenDone(JobId jobId) {
        return registry.handle(jobId).observe();
    }

    // ==================== CONCURRENCY ====================

    @Override
    public void setMaxConcurrency(Integer maxConcurrency) {
        synchronized (registry) {
            // Permits held under the old limiter are released back to it
            limiter = new ConcurrencyLimiter(maxConcurrency);
        }
        logger.info("Max concurrency set to " + describe(maxConcurrency));
    }

    @Override
    public Integer getMaxConcurrency() {
        synchronized (registry) {
            return limiter.getMaxConcurrency();
        }
    }

    /**
     * @return number of jobs currently in RUNNING status
     */
    public int getRunningCount() {
        return registry.countByStatus().get(JobStatus.RUNNING);
    }

    /**
     * Get the current status of the scheduler.
     *
     * @return map of scheduler settings, limiter state and job counts per status
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("name", config.getName());
        stats.put("shutdown", shutdown.get());
        stats.put("workerThreads", config.getWorkerThreads());

        ConcurrencyLimiter current;
        synchronized (registry) {
            current = limiter;
        }
        stats.put("maxConcurrency", current.getMaxConcurrency());
        stats.put("activePermits", current.getActiveCount());
        stats.put("waitingForPermit", current.getWaitingCount());

        Map<JobStatus, Integer> counts = registry.countByStatus();
        int total = 0;
        for (Map.Entry<JobStatus, Integer> entry : counts.entrySet()) {
            stats.put(entry.getKey().wireName(), entry.getValue());
            total += entry.getValue();
        }
        stats.put("total", total);
        return stats;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    // ==================== LIFECYCLE ====================

    /**
     * Shut the scheduler down gracefully.
     *
     * <p>Stops accepting jobs, requests cancellation of every job that is not yet
     * terminal, then waits up to the configured shutdown timeout for the pools to
     * drain before forcing them down. Records stay readable afterwards.</p>
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Initiating graceful shutdown...");

        for (JobHandle handle : registry.activeHandles()) {
            handle.getContext().cancel();
        }

        dispatcher.shutdown();
        workerPool.shutdown();

        long timeoutMillis = config.getShutdownTimeout().toMillis();
        try {
            if (!dispatcher.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)
                    || !workerPool.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                logger.warning("Forcing shutdown of remaining tasks");
                dispatcher.shutdownNow();
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Scheduler shutdown complete");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    private static String describe(Integer maxConcurrency) {
        return (maxConcurrency == null || maxConcurrency <= 0) ? "unbounded" : maxConcurrency.toString();
    }

    /**
     * Daemon threads named {@code <prefix>-N}, so an abandoned scheduler never keeps the JVM alive.
     */
    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(1);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
            return thread;
        }
    }
}
