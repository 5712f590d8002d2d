package io.github.byzatic.jobs.config;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine settings. Built in code with {@link Builder}, or read from {@code jobs-engine.properties}
 * on the classpath with {@link #load()}.
 */
public final class JobsConfig {
    private final static Logger logger = LoggerFactory.getLogger(JobsConfig.class);

    public static final String RESOURCE_NAME = "jobs-engine.properties";

    public static final int DEFAULT_CORE_POOL_SIZE = Math.max(2, Runtime.getRuntime().availableProcessors());
    public static final int DEFAULT_MAX_POOL_SIZE = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);
    public static final int DEFAULT_MAX_CONCURRENCY = 0;
    public static final int DEFAULT_CATALOG_PAGE_SIZE = 100;
    public static final Duration DEFAULT_STUCK_SWEEP_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_STUCK_THRESHOLD = Duration.ofHours(1);
    public static final Duration DEFAULT_CLOSE_GRACE = Duration.ofSeconds(10);

    private final int corePoolSize;
    private final int maxPoolSize;
    private final int defaultMaxConcurrency;
    private final int catalogPageSize;
    private final Duration stuckSweepInterval;
    private final Duration stuckThreshold;
    private final Duration closeGrace;
    private final boolean deleteStopsRunning;
    private final boolean taskCanStop;
    private final boolean taskCanPause;
    private final boolean taskHasProgress;
    private final Clock clock;

    private JobsConfig(Builder builder) {
        this.corePoolSize = builder.corePoolSize;
        this.maxPoolSize = Math.max(builder.corePoolSize, builder.maxPoolSize);
        this.defaultMaxConcurrency = builder.defaultMaxConcurrency;
        this.catalogPageSize = builder.catalogPageSize;
        this.stuckSweepInterval = builder.stuckSweepInterval;
        this.stuckThreshold = builder.stuckThreshold;
        this.closeGrace = builder.closeGrace;
        this.deleteStopsRunning = builder.deleteStopsRunning;
        this.taskCanStop = builder.taskCanStop;
        this.taskCanPause = builder.taskCanPause;
        this.taskHasProgress = builder.taskHasProgress;
        this.clock = builder.clock;
    }

    public static JobsConfig defaults() {
        return new Builder().build();
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the classpath, falling back to defaults when absent.
     */
    public static JobsConfig load() throws ConfigurationException {
        Properties properties = new Properties();
        try (InputStream in = JobsConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", RESOURCE_NAME);
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Can't read " + RESOURCE_NAME, e);
        }
        return fromProperties(properties);
    }

    public static JobsConfig fromProperties(@NotNull Properties p) throws ConfigurationException {
        int corePoolSize = intValue(p, "jobs.executor.core-pool-size", DEFAULT_CORE_POOL_SIZE);
        int maxPoolSize = intValue(p, "jobs.executor.max-pool-size", DEFAULT_MAX_POOL_SIZE);
        int maxConcurrency = intValue(p, "jobs.default-max-concurrency", DEFAULT_MAX_CONCURRENCY);
        int pageSize = intValue(p, "jobs.catalog.page-size", DEFAULT_CATALOG_PAGE_SIZE);
        Duration sweepInterval = durationValue(p, "jobs.stuck.sweep-interval", DEFAULT_STUCK_SWEEP_INTERVAL);
        Duration threshold = durationValue(p, "jobs.stuck.threshold", DEFAULT_STUCK_THRESHOLD);
        Duration closeGrace = durationValue(p, "jobs.close.grace", DEFAULT_CLOSE_GRACE);
        try {
            return new Builder()
                    .corePoolSize(corePoolSize)
                    .maxPoolSize(maxPoolSize)
                    .defaultMaxConcurrency(maxConcurrency)
                    .catalogPageSize(pageSize)
                    .stuckSweepInterval(sweepInterval)
                    .stuckThreshold(threshold)
                    .closeGrace(closeGrace)
                    .deleteStopsRunning(booleanValue(p, "jobs.delete-stops-running", true))
                    .taskCanStop(booleanValue(p, "jobs.task.can-stop", true))
                    .taskCanPause(booleanValue(p, "jobs.task.can-pause", true))
                    .taskHasProgress(booleanValue(p, "jobs.task.has-progress", true))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static int intValue(Properties p, String key, int defaultValue) throws ConfigurationException {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " is not an integer: " + raw, e);
        }
    }

    private static Duration durationValue(Properties p, String key, Duration defaultValue) throws ConfigurationException {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Duration.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Property " + key + " is not an ISO-8601 duration: " + raw, e);
        }
    }

    private static boolean booleanValue(Properties p, String key, boolean defaultValue) {
        String raw = p.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    public int getCorePoolSize() {
        return corePoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    /**
     * Ceiling applied to jobs declaring no max concurrency; 0 means unbounded.
     */
    public int getDefaultMaxConcurrency() {
        return defaultMaxConcurrency;
    }

    public int getCatalogPageSize() {
        return catalogPageSize;
    }

    public @NotNull Duration getStuckSweepInterval() {
        return stuckSweepInterval;
    }

    public @NotNull Duration getStuckThreshold() {
        return stuckThreshold;
    }

    public @NotNull Duration getCloseGrace() {
        return closeGrace;
    }

    public boolean isDeleteStopsRunning() {
        return deleteStopsRunning;
    }

    public boolean isTaskCanStop() {
        return taskCanStop;
    }

    public boolean isTaskCanPause() {
        return taskCanPause;
    }

    public boolean isTaskHasProgress() {
        return taskHasProgress;
    }

    public @NotNull Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "JobsConfig{" +
                "corePoolSize=" + corePoolSize +
                ", maxPoolSize=" + maxPoolSize +
                ", defaultMaxConcurrency=" + defaultMaxConcurrency +
                ", catalogPageSize=" + catalogPageSize +
                ", stuckSweepInterval=" + stuckSweepInterval +
                ", stuckThreshold=" + stuckThreshold +
                ", closeGrace=" + closeGrace +
                ", deleteStopsRunning=" + deleteStopsRunning +
                '}';
    }

    public static final class Builder {
        private int corePoolSize = DEFAULT_CORE_POOL_SIZE;
        private int maxPoolSize = DEFAULT_MAX_POOL_SIZE;
        private int defaultMaxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private int catalogPageSize = DEFAULT_CATALOG_PAGE_SIZE;
        private Duration stuckSweepInterval = DEFAULT_STUCK_SWEEP_INTERVAL;
        private Duration stuckThreshold = DEFAULT_STUCK_THRESHOLD;
        private Duration closeGrace = DEFAULT_CLOSE_GRACE;
        private boolean deleteStopsRunning = true;
        private boolean taskCanStop = true;
        private boolean taskCanPause = true;
        private boolean taskHasProgress = true;
        private Clock clock = Clock.systemUTC();

        public Builder corePoolSize(int corePoolSize) {
            if (corePoolSize <= 0) throw new IllegalArgumentException("corePoolSize must be > 0");
            this.corePoolSize = corePoolSize;
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder defaultMaxConcurrency(int defaultMaxConcurrency) {
            this.defaultMaxConcurrency = Math.max(0, defaultMaxConcurrency);
            return this;
        }

        public Builder catalogPageSize(int catalogPageSize) {
            if (catalogPageSize <= 0) throw new IllegalArgumentException("catalogPageSize must be > 0");
            this.catalogPageSize = catalogPageSize;
            return this;
        }

        /**
         * Period of the background stuck-task sweep; zero disables it.
         */
        public Builder stuckSweepInterval(Duration interval) {
            if (Objects.requireNonNull(interval).isNegative()) throw new IllegalArgumentException("interval must be >= 0");
            this.stuckSweepInterval = interval;
            return this;
        }

        public Builder stuckThreshold(Duration threshold) {
            if (Objects.requireNonNull(threshold).isNegative() || threshold.isZero()) {
                throw new IllegalArgumentException("threshold must be > 0");
            }
            this.stuckThreshold = threshold;
            return this;
        }

        /**
         * Grace period granted to running tasks when the engine closes.
         */
        public Builder closeGrace(Duration grace) {
            this.closeGrace = Objects.requireNonNull(grace);
            return this;
        }

        /**
         * When true, deleting a running task stops it first; otherwise the delete is refused.
         */
        public Builder deleteStopsRunning(boolean deleteStopsRunning) {
            this.deleteStopsRunning = deleteStopsRunning;
            return this;
        }

        public Builder taskCanStop(boolean canStop) {
            this.taskCanStop = canStop;
            return this;
        }

        public Builder taskCanPause(boolean canPause) {
            this.taskCanPause = canPause;
            return this;
        }

        public Builder taskHasProgress(boolean hasProgress) {
            this.taskHasProgress = hasProgress;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public JobsConfig build() {
            return new JobsConfig(this);
        }
    }
}
