package io.github.byzatic.jobs.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.JobTriggerEvent;
import io.github.byzatic.jobs.model.Schedule;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fires {@link JobTriggerEvent}s at the fire times of registered job schedules.
 * <p>
 * A single dispatcher thread drains a {@link DelayQueue}; each registered job has at most one pending
 * entry. Registering a job again replaces its schedule, the stale entry is dropped when it comes due.
 */
@ThreadSafe
public final class JobTimer implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(JobTimer.class);

    private final Clock clock;
    private final Consumer<JobTriggerEvent> sink;
    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    private final Map<String, TimerRecord> timers = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private final Thread dispatcher;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public JobTimer(@NotNull Clock clock, @NotNull Consumer<JobTriggerEvent> sink) {
        this.clock = Objects.requireNonNull(clock);
        this.sink = Objects.requireNonNull(sink);

        this.dispatcher = new Thread(this::dispatchLoop, "jobs-timer");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    /**
     * Starts firing the job at its schedule. A job without schedule, or with a malformed one, is only
     * unregistered.
     *
     * @return true when the job has a pending fire time
     */
    public boolean register(@NotNull Job job) {
        if (!job.hasSchedule()) {
            unregister(job.getId());
            return false;
        }
        Schedule schedule = Objects.requireNonNull(job.getSchedule());
        FireTimeSequence sequence;
        try {
            sequence = ScheduleEngine.nextFireTimes(schedule, clock.instant());
        } catch (ConfigurationException e) {
            logger.warn("Job {} has an invalid schedule {}, treated as schedule-less: {}", job.getId(), schedule, e.getMessage());
            unregister(job.getId());
            return false;
        }
        TimerRecord rec = new TimerRecord(job.getId(), schedule, sequence, generations.incrementAndGet());
        timers.put(job.getId(), rec);
        boolean pending = scheduleNext(rec);
        logger.debug("Job {} registered with schedule {}, pending={}", job.getId(), schedule, pending);
        return pending;
    }

    public boolean unregister(@NotNull String jobId) {
        return timers.remove(jobId) != null;
    }

    public boolean isRegistered(@NotNull String jobId) {
        return timers.containsKey(jobId);
    }

    public Set<String> registeredJobs() {
        return Set.copyOf(timers.keySet());
    }

    @Override
    public void close() {
        running.set(false);
        dispatcher.interrupt();
        timers.clear();
        queue.clear();
    }

    private boolean scheduleNext(TimerRecord rec) {
        synchronized (rec) {
            if (!rec.sequence.hasNext()) {
                timers.remove(rec.jobId, rec);
                logger.debug("Schedule {} of job {} is exhausted", rec.schedule, rec.jobId);
                return false;
            }
            Instant next = rec.sequence.next();
            queue.offer(new ScheduledEntry(rec.jobId, rec.generation, next.toEpochMilli(), clock));
            return true;
        }
    }

    private void dispatchLoop() {
        while (running.get()) {
            try {
                ScheduledEntry entry = queue.take();
                TimerRecord rec = timers.get(entry.jobId);
                if (rec == null || rec.generation != entry.generation) continue;

                synchronized (rec) {
                    rec.sequence.markFired(clock.instant());
                }
                try {
                    sink.accept(new JobTriggerEvent(rec.jobId, rec.schedule, false));
                } catch (Throwable t) {
                    logger.error("Trigger of job {} failed", rec.jobId, t);
                }
                if (timers.get(rec.jobId) == rec) scheduleNext(rec);
            } catch (InterruptedException ie) {
                if (!running.get()) break;
            } catch (Throwable t) {
                logger.error("Timer dispatcher error", t);
            }
        }
    }

    private static final class TimerRecord {
        final String jobId;
        final Schedule schedule;
        final FireTimeSequence sequence;
        final long generation;

        TimerRecord(String jobId, Schedule schedule, FireTimeSequence sequence, long generation) {
            this.jobId = jobId;
            this.schedule = schedule;
            this.sequence = sequence;
            this.generation = generation;
        }
    }
}
