package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * ISO-8601 repeating interval {@code R<n>/<start>/<period>}, e.g. {@code R3/2024-01-01T00:00:00Z/PT5S}.
 * <p>
 * {@code R} or {@code R0} repeats forever. The start is an offset date-time, UTC when the offset is
 * omitted. The date part of the period ({@code P1M}, {@code P2W}) uses calendar arithmetic in the start
 * offset, the time part ({@code PT4S}) is an exact duration.
 */
public final class IsoRepeatingInterval {
    private final long repetitions;
    private final OffsetDateTime start;
    private final Period datePart;
    private final Duration timePart;

    private IsoRepeatingInterval(long repetitions, OffsetDateTime start, Period datePart, Duration timePart) {
        this.repetitions = repetitions;
        this.start = start;
        this.datePart = datePart;
        this.timePart = timePart;
    }

    public static @NotNull IsoRepeatingInterval parse(@NotNull String value) throws ConfigurationException {
        Objects.requireNonNull(value);
        String[] parts = value.trim().split("/");
        if (parts.length != 3) {
            throw new ConfigurationException("Expected R<n>/<start>/<period>, got '" + value + "'");
        }
        long repetitions = parseRepetitions(parts[0], value);
        OffsetDateTime start = parseStart(parts[1], value);
        String period = parts[2];
        if (period.isEmpty() || period.charAt(0) != 'P') {
            throw new ConfigurationException("Malformed period '" + period + "' in '" + value + "'");
        }
        int t = period.indexOf('T');
        String date = t < 0 ? period : period.substring(0, t);
        Period datePart;
        Duration timePart;
        try {
            datePart = "P".equals(date) ? Period.ZERO : Period.parse(date);
            timePart = t < 0 ? Duration.ZERO : Duration.parse("P" + period.substring(t));
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Malformed period '" + period + "' in '" + value + "'", e);
        }
        if (datePart.isNegative() || timePart.isNegative() || (datePart.isZero() && timePart.isZero())) {
            throw new ConfigurationException("Period must be positive in '" + value + "'");
        }
        return new IsoRepeatingInterval(repetitions, start, datePart, timePart);
    }

    private static long parseRepetitions(String r, String value) throws ConfigurationException {
        if (r.isEmpty() || r.charAt(0) != 'R') {
            throw new ConfigurationException("Missing repetition count in '" + value + "'");
        }
        if (r.length() == 1) return 0;
        try {
            long n = Long.parseLong(r.substring(1));
            if (n < 0) throw new ConfigurationException("Negative repetition count in '" + value + "'");
            return n;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Malformed repetition count '" + r + "' in '" + value + "'", e);
        }
    }

    private static OffsetDateTime parseStart(String s, String value) throws ConfigurationException {
        try {
            return OffsetDateTime.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(s).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                throw new ConfigurationException("Malformed start '" + s + "' in '" + value + "'", e);
            }
        }
    }

    /**
     * Unbounded when 0.
     */
    public long getRepetitions() {
        return repetitions;
    }

    public boolean isUnbounded() {
        return repetitions == 0;
    }

    public @NotNull Instant getStart() {
        return start.toInstant();
    }

    /**
     * The n-th occurrence, counting from 0 at the start.
     *
     * @throws ConfigurationException when the occurrence is out of the supported time range
     */
    public @NotNull Instant occurrence(long n) throws ConfigurationException {
        try {
            OffsetDateTime at = start;
            if (!datePart.isZero()) at = at.plus(datePart.multipliedBy(Math.toIntExact(n)));
            if (!timePart.isZero()) at = at.plus(timePart.multipliedBy(n));
            return at.toInstant();
        } catch (ArithmeticException | DateTimeException e) {
            throw new ConfigurationException("Occurrence " + n + " of " + this + " is out of range", e);
        }
    }

    /**
     * Index of the first occurrence at or after {@code instant}.
     */
    long firstIndexNotBefore(Instant instant) throws ConfigurationException {
        if (!instant.isAfter(getStart())) return 0;
        if (datePart.isZero()) {
            long elapsed = Duration.between(getStart(), instant).toMillis();
            long step = timePart.toMillis();
            if (step > 0) {
                long n = Math.max(0, elapsed / step - 1);
                while (occurrence(n).isBefore(instant)) n++;
                return n;
            }
        }
        long n = 0;
        while (occurrence(n).isBefore(instant)) n++;
        return n;
    }

    @Override
    public String toString() {
        return "R" + (repetitions == 0 ? "" : repetitions) + "/" + start + "/" + datePart + (timePart.isZero() ? "" : "+" + timePart);
    }
}
