package io.github.byzatic.jobs.tasks;

import io.github.byzatic.jobs.config.JobsConfig;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Interrupts tasks left running without any update for too long.
 * <p>
 * Recovery is best-effort: the task is marked interrupted and its slot is given back, an action
 * invocation still in flight is left to finish and its result is dropped.
 */
public final class StuckTaskDetector implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(StuckTaskDetector.class);

    private final TaskSupervisor supervisor;
    private final Duration interval;
    private final Duration threshold;
    private ScheduledExecutorService sweeper;

    public StuckTaskDetector(@NotNull TaskSupervisor supervisor, @NotNull JobsConfig config) {
        this.supervisor = Objects.requireNonNull(supervisor);
        this.interval = config.getStuckSweepInterval();
        this.threshold = config.getStuckThreshold();
    }

    /**
     * @param sinceSeconds age in seconds of the last update past which a running task is stuck
     * @return IDs of the repaired tasks
     */
    public @NotNull List<String> sweep(int sinceSeconds) {
        if (sinceSeconds < 0) throw new IllegalArgumentException("sinceSeconds must be >= 0");
        List<String> fixed = supervisor.interruptStuck(Duration.ofSeconds(sinceSeconds));
        if (!fixed.isEmpty()) logger.info("Stuck task sweep interrupted {} task(s): {}", fixed.size(), fixed);
        return fixed;
    }

    /**
     * Sweeps periodically with the configured threshold. Does nothing when the interval is zero.
     */
    public synchronized void start() {
        if (sweeper != null || interval.isZero()) return;
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jobs-stuck-detector");
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex));
            return t;
        });
        long period = interval.toMillis();
        int since = (int) Math.min(Integer.MAX_VALUE, threshold.getSeconds());
        sweeper.scheduleAtFixedRate(() -> {
            try {
                sweep(since);
            } catch (Throwable t) {
                logger.error("Stuck task sweep failed", t);
            }
        }, period, period, TimeUnit.MILLISECONDS);
        logger.debug("Stuck task detector started: every {}, threshold {}", interval, threshold);
    }

    @Override
    public synchronized void close() {
        if (sweeper == null) return;
        sweeper.shutdownNow();
        sweeper = null;
    }
}
