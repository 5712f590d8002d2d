package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy sequence of fire instants of a repeating interval, never closer than the minimum delta to
 * the previous firing. Occurrences before the starting instant are missed but still count towards
 * the repetition count.
 * <p>
 * Not thread-safe: owned by whoever fires the job.
 */
public final class FireTimeSequence implements Iterator<Instant> {
    private final static Logger logger = LoggerFactory.getLogger(FireTimeSequence.class);

    private final IsoRepeatingInterval interval;
    private final Duration minDelta;
    private long index;
    private Instant lastFiring;
    private boolean broken;

    FireTimeSequence(@NotNull IsoRepeatingInterval interval, @NotNull Duration minDelta, @NotNull Instant after) throws ConfigurationException {
        this.interval = interval;
        this.minDelta = minDelta;
        this.index = interval.firstIndexNotBefore(after);
    }

    @Override
    public boolean hasNext() {
        return !broken && (interval.isUnbounded() || index < interval.getRepetitions());
    }

    @Override
    public Instant next() {
        if (!hasNext()) throw new NoSuchElementException("Schedule " + interval + " is exhausted");
        Instant scheduled;
        try {
            scheduled = interval.occurrence(index++);
        } catch (ConfigurationException e) {
            logger.warn("Schedule {} stops: {}", interval, e.getMessage());
            broken = true;
            throw new NoSuchElementException(e.getMessage());
        }
        Instant fireAt = scheduled;
        if (lastFiring != null) {
            Instant earliest = lastFiring.plus(minDelta);
            if (fireAt.isBefore(earliest)) fireAt = earliest;
        }
        lastFiring = fireAt;
        return fireAt;
    }

    /**
     * Records when the last emitted instant actually fired, if later than planned.
     */
    public void markFired(@NotNull Instant actual) {
        if (lastFiring == null || actual.isAfter(lastFiring)) lastFiring = actual;
    }

    public @Nullable Instant getLastFiring() {
        return lastFiring;
    }

    /**
     * Occurrences consumed so far, missed ones included.
     */
    public long getConsumed() {
        return index;
    }
}
