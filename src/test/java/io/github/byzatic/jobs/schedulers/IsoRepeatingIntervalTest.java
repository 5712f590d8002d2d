package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IsoRepeatingIntervalTest {

    @Test
    void parsesCountStartAndPeriod() throws Exception {
        IsoRepeatingInterval i = IsoRepeatingInterval.parse("R2/2015-06-04T19:25:16.828696-07:00/PT4S");
        assertEquals(2, i.getRepetitions());
        assertFalse(i.isUnbounded());
        assertEquals(Instant.parse("2015-06-05T02:25:16.828696Z"), i.getStart());
        assertEquals(Instant.parse("2015-06-05T02:25:20.828696Z"), i.occurrence(1));
    }

    @Test
    void bareOrZeroRepetitionIsUnbounded() throws Exception {
        assertTrue(IsoRepeatingInterval.parse("R/2024-01-01T00:00:00Z/PT1M").isUnbounded());
        assertTrue(IsoRepeatingInterval.parse("R0/2024-01-01T00:00:00Z/PT1M").isUnbounded());
    }

    @Test
    void datePartUsesCalendarArithmetic() throws Exception {
        IsoRepeatingInterval i = IsoRepeatingInterval.parse("R0/2024-01-31T10:00:00Z/P1M");
        assertEquals(Instant.parse("2024-02-29T10:00:00Z"), i.occurrence(1));
        assertEquals(Instant.parse("2024-03-31T10:00:00Z"), i.occurrence(2));
    }

    @Test
    void mixedPeriodAddsBothParts() throws Exception {
        IsoRepeatingInterval i = IsoRepeatingInterval.parse("R0/2024-01-01T00:00:00Z/P1DT2H");
        assertEquals(Instant.parse("2024-01-03T04:00:00Z"), i.occurrence(2));
    }

    @Test
    void startWithoutOffsetIsUtc() throws Exception {
        IsoRepeatingInterval i = IsoRepeatingInterval.parse("R1/2024-01-01T08:00:00/PT1H");
        assertEquals(Instant.parse("2024-01-01T08:00:00Z"), i.getStart());
    }

    @Test
    void firstIndexNotBeforeSkipsPastOccurrences() throws Exception {
        IsoRepeatingInterval i = IsoRepeatingInterval.parse("R0/2024-01-01T00:00:00Z/PT10S");
        assertEquals(0, i.firstIndexNotBefore(Instant.parse("2023-12-31T00:00:00Z")));
        assertEquals(3, i.firstIndexNotBefore(Instant.parse("2024-01-01T00:00:30Z")));
        assertEquals(4, i.firstIndexNotBefore(Instant.parse("2024-01-01T00:00:30.001Z")));
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(ConfigurationException.class, () -> IsoRepeatingInterval.parse("every 5 seconds"));
        assertThrows(ConfigurationException.class, () -> IsoRepeatingInterval.parse("X3/2024-01-01T00:00:00Z/PT5S"));
        assertThrows(ConfigurationException.class, () -> IsoRepeatingInterval.parse("Rx/2024-01-01T00:00:00Z/PT5S"));
        assertThrows(ConfigurationException.class, () -> IsoRepeatingInterval.parse("R3/yesterday/PT5S"));
        assertThrows(ConfigurationException.class, () -> IsoRepeatingInterval.parse("R3/2024-01-01T00:00:00Z/5S"));
        assertThrows(ConfigurationException.class, () -> IsoRepeatingInterval.parse("R3/2024-01-01T00:00:00Z/PT0S"));
        assertThrows(ConfigurationException.class, () -> IsoRepeatingInterval.parse("R-1/2024-01-01T00:00:00Z/PT5S"));
    }
}
