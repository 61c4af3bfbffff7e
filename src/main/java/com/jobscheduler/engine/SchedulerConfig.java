package com.jobscheduler.engine;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduler settings.
 *
 * <p>Values come from, in increasing precedence: built-in defaults, the
 * {@value #RESOURCE} classpath resource, and JVM system properties with the same
 * keys ({@code -Dscheduler.max-concurrency=4}).</p>
 *
 * <table>
 *   <caption>Keys</caption>
 *   <tr><th>Key</th><th>Default</th></tr>
 *   <tr><td>{@code scheduler.name}</td><td>{@code scheduler}</td></tr>
 *   <tr><td>{@code scheduler.max-concurrency}</td><td>unset (unbounded)</td></tr>
 *   <tr><td>{@code scheduler.worker-threads}</td><td>max(4, available processors)</td></tr>
 *   <tr><td>{@code scheduler.shutdown-timeout-seconds}</td><td>30</td></tr>
 *   <tr><td>{@code scheduler.stream.poll-interval-ms}</td><td>500</td></tr>
 * </table>
 *
 * @author Job Scheduler Team
 */
public final class SchedulerConfig {
    private static final Logger logger = Logger.getLogger(SchedulerConfig.class.getName());

    public static final String RESOURCE = "jobscheduler.properties";

    public static final String KEY_NAME = "scheduler.name";
    public static final String KEY_MAX_CONCURRENCY = "scheduler.max-concurrency";
    public static final String KEY_WORKER_THREADS = "scheduler.worker-threads";
    public static final String KEY_SHUTDOWN_TIMEOUT = "scheduler.shutdown-timeout-seconds";
    public static final String KEY_POLL_INTERVAL = "scheduler.stream.poll-interval-ms";

    private final String name;
    private final Integer maxConcurrency;
    private final int workerThreads;
    private final Duration shutdownTimeout;
    private final Duration streamPollInterval;

    private SchedulerConfig(Builder builder) {
        this.name = builder.name;
        this.maxConcurrency = (builder.maxConcurrency != null && builder.maxConcurrency > 0)
            ? builder.maxConcurrency : null;
        this.workerThreads = builder.workerThreads;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.streamPollInterval = builder.streamPollInterval;
    }

    /**
     * @return built-in defaults, ignoring resources and system properties
     */
    public static SchedulerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load from the classpath resource, then apply system property overrides.
     *
     * @return the effective configuration
     * @throws IllegalArgumentException if a value is malformed
     */
    public static SchedulerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read " + RESOURCE + ", using defaults", e);
        }

        for (String key : new String[] {KEY_NAME, KEY_MAX_CONCURRENCY, KEY_WORKER_THREADS,
                                         KEY_SHUTDOWN_TIMEOUT, KEY_POLL_INTERVAL}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    /**
     * Build from a property set. Missing keys take their defaults.
     *
     * @param properties source properties
     * @return the configuration
     * @throws IllegalArgumentException naming the key if a value is malformed
     */
    public static SchedulerConfig fromProperties(Properties properties) {
        Builder builder = builder();

        String name = properties.getProperty(KEY_NAME);
        if (name != null && !name.isBlank()) {
            builder.name(name.trim());
        }
        Integer maxConcurrency = intValue(properties, KEY_MAX_CONCURRENCY);
        if (maxConcurrency != null) {
            builder.maxConcurrency(maxConcurrency);
        }
        Integer workerThreads = intValue(properties, KEY_WORKER_THREADS);
        if (workerThreads != null) {
            builder.workerThreads(workerThreads);
        }
        Integer shutdownSeconds = intValue(properties, KEY_SHUTDOWN_TIMEOUT);
        if (shutdownSeconds != null) {
            builder.shutdownTimeout(Duration.ofSeconds(shutdownSeconds));
        }
        Integer pollMillis = intValue(properties, KEY_POLL_INTERVAL);
        if (pollMillis != null) {
            builder.streamPollInterval(Duration.ofMillis(pollMillis));
        }
        return builder.build();
    }

    private static Integer intValue(Properties properties, String key) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + raw + "'", e);
        }
    }

    /**
     * @return prefix for scheduler thread names
     */
    public String getName() {
        return name;
    }

    /**
     * @return concurrency ceiling, or null when unbounded
     */
    public Integer getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration getStreamPollInterval() {
        return streamPollInterval;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "name='" + name + '\'' +
                ", maxConcurrency=" + (maxConcurrency == null ? "unbounded" : maxConcurrency) +
                ", workerThreads=" + workerThreads +
                ", shutdownTimeout=" + shutdownTimeout +
                ", streamPollInterval=" + streamPollInterval +
                '}';
    }

    public static final class Builder {
        private String name = "scheduler";
        private Integer maxConcurrency;
        private int workerThreads = Math.max(4, Runtime.getRuntime().availableProcessors());
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private Duration streamPollInterval = Duration.ofMillis(500);

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * @param maxConcurrency ceiling; null, zero or negative for unbounded
         */
        public Builder maxConcurrency(Integer maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1, got " + workerThreads);
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must be non-negative");
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder streamPollInterval(Duration streamPollInterval) {
            if (streamPollInterval == null || streamPollInterval.toMillis() < 1) {
                throw new IllegalArgumentException("streamPollInterval must be at least 1ms");
            }
            this.streamPollInterval = streamPollInterval;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
