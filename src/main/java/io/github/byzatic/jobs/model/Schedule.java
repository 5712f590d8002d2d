package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Periodic trigger of a job.
 *
 * @see io.github.byzatic.jobs.schedulers.IsoRepeatingInterval
 */
public final class Schedule {
    private final String iso8601Schedule;
    private final String iso8601MinDelta;

    /**
     * @param iso8601Schedule repeating interval, e.g. {@code R2/2015-06-04T19:25:16.828696-07:00/PT4S}; R0 repeats forever
     * @param iso8601MinDelta minimum duration between two runs, e.g. {@code PT10S}; empty for none
     */
    public Schedule(@NotNull String iso8601Schedule, String iso8601MinDelta) {
        this.iso8601Schedule = Objects.requireNonNull(iso8601Schedule);
        this.iso8601MinDelta = iso8601MinDelta == null ? "" : iso8601MinDelta;
    }

    public Schedule(@NotNull String iso8601Schedule) {
        this(iso8601Schedule, "");
    }

    public @NotNull String getIso8601Schedule() {
        return iso8601Schedule;
    }

    public @NotNull String getIso8601MinDelta() {
        return iso8601MinDelta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schedule schedule = (Schedule) o;
        return iso8601Schedule.equals(schedule.iso8601Schedule) && iso8601MinDelta.equals(schedule.iso8601MinDelta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(iso8601Schedule, iso8601MinDelta);
    }

    @Override
    public String toString() {
        return "Schedule{'" + iso8601Schedule + "'" + (iso8601MinDelta.isEmpty() ? "" : ", minDelta='" + iso8601MinDelta + "'") + '}';
    }
}
