package io.github.byzatic.jobs.schedulers;

import java.time.Clock;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

final class ScheduledEntry implements Delayed {
    final String jobId;
    final long generation;
    final long triggerAtMillis;
    private final Clock clock;

    ScheduledEntry(String jobId, long generation, long triggerAtMillis, Clock clock) {
        this.jobId = jobId;
        this.generation = generation;
        this.triggerAtMillis = triggerAtMillis;
        this.clock = clock;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        long diff = triggerAtMillis - clock.millis();
        return unit.convert(diff, TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        return Long.compare(this.triggerAtMillis, ((ScheduledEntry) o).triggerAtMillis);
    }
}
