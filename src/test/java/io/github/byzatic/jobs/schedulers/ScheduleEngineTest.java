package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.model.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleEngineTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void emitsExactlyRepetitionCountInstants() throws Exception {
        FireTimeSequence seq = ScheduleEngine.nextFireTimes(new Schedule("R3/2024-01-01T00:00:00Z/PT5S", "PT2S"), T0);
        List<Instant> fired = new ArrayList<>();
        while (seq.hasNext()) fired.add(seq.next());
        assertEquals(List.of(T0, T0.plusSeconds(5), T0.plusSeconds(10)), fired);
        assertThrows(NoSuchElementException.class, seq::next);
    }

    @Test
    void lateFiringPushesNextInstantByMinDelta() throws Exception {
        FireTimeSequence seq = ScheduleEngine.nextFireTimes(new Schedule("R3/2024-01-01T00:00:00Z/PT5S", "PT2S"), T0);
        Instant first = seq.next();
        seq.markFired(T0.plusSeconds(4));
        Instant second = seq.next();
        assertEquals(T0.plusSeconds(6), second);
        seq.markFired(second);
        Instant third = seq.next();
        assertEquals(T0.plusSeconds(10), third);
        assertFalse(seq.hasNext());

        assertTrue(Duration.between(T0.plusSeconds(4), second).compareTo(Duration.ofSeconds(2)) >= 0);
        assertEquals(T0, first);
    }

    @Test
    void periodShorterThanMinDeltaIsThrottled() throws Exception {
        FireTimeSequence seq = ScheduleEngine.nextFireTimes(new Schedule("R3/2024-01-01T00:00:00Z/PT1S", "PT2S"), T0);
        assertEquals(T0, seq.next());
        assertEquals(T0.plusSeconds(2), seq.next());
        assertEquals(T0.plusSeconds(4), seq.next());
        assertFalse(seq.hasNext());
    }

    @Test
    void missedOccurrencesCountTowardsRepetitions() throws Exception {
        FireTimeSequence seq = ScheduleEngine.nextFireTimes(new Schedule("R3/2024-01-01T00:00:00Z/PT5S"), T0.plusSeconds(7));
        assertEquals(2, seq.getConsumed());
        assertEquals(T0.plusSeconds(10), seq.next());
        assertFalse(seq.hasNext());
    }

    @Test
    void unboundedScheduleKeepsGoing() throws Exception {
        FireTimeSequence seq = ScheduleEngine.nextFireTimes(new Schedule("R/2024-01-01T00:00:00Z/PT1H"), T0);
        Instant last = null;
        for (int i = 0; i < 1000; i++) last = seq.next();
        assertEquals(T0.plus(Duration.ofHours(999)), last);
        assertTrue(seq.hasNext());
    }

    @Test
    void malformedMinDeltaIsConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> ScheduleEngine.nextFireTimes(new Schedule("R3/2024-01-01T00:00:00Z/PT5S", "two seconds"), T0));
        assertThrows(ConfigurationException.class,
                () -> ScheduleEngine.validate(new Schedule("R3/2024-01-01T00:00:00Z/PT5S", "-PT2S")));
    }

    @Test
    void emptyMinDeltaMeansNoThrottle() throws Exception {
        assertEquals(Duration.ZERO, ScheduleEngine.parseMinDelta(""));
        assertEquals(Duration.ZERO, ScheduleEngine.parseMinDelta(null));
        assertEquals(Duration.ofSeconds(30), ScheduleEngine.parseMinDelta("PT30S"));
    }
}
