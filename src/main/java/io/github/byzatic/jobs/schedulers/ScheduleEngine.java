package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.model.Schedule;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Computes the fire times of a job {@link Schedule}.
 */
public final class ScheduleEngine {

    private ScheduleEngine() {
    }

    /**
     * @param after occurrences strictly before this instant are skipped
     * @throws ConfigurationException on a malformed schedule or minimum delta
     */
    public static @NotNull FireTimeSequence nextFireTimes(@NotNull Schedule schedule, @NotNull Instant after) throws ConfigurationException {
        IsoRepeatingInterval interval = IsoRepeatingInterval.parse(schedule.getIso8601Schedule());
        return new FireTimeSequence(interval, parseMinDelta(schedule.getIso8601MinDelta()), after);
    }

    /**
     * Fails the same way {@link #nextFireTimes} would.
     */
    public static void validate(@NotNull Schedule schedule) throws ConfigurationException {
        IsoRepeatingInterval.parse(schedule.getIso8601Schedule());
        parseMinDelta(schedule.getIso8601MinDelta());
    }

    static Duration parseMinDelta(String value) throws ConfigurationException {
        if (value == null || value.isBlank()) return Duration.ZERO;
        try {
            Duration delta = Duration.parse(value.trim());
            if (delta.isNegative()) throw new ConfigurationException("Negative minimum delta '" + value + "'");
            return delta;
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Malformed minimum delta '" + value + "'", e);
        }
    }
}
