package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.JobTriggerEvent;
import io.github.byzatic.jobs.model.Schedule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobTimerTest {
    JobTimer timer;

    @AfterEach
    void tearDown() {
        if (timer != null) timer.close();
    }

    private static String startingSoon() {
        return DateTimeFormatter.ISO_INSTANT.format(Instant.now().plusMillis(100).truncatedTo(ChronoUnit.MILLIS));
    }

    @Test
    void firesEachOccurrenceWithScheduleSnapshot() throws Exception {
        CountDownLatch latch = new CountDownLatch(3);
        List<JobTriggerEvent> events = new CopyOnWriteArrayList<>();
        timer = new JobTimer(Clock.systemUTC(), e -> {
            events.add(e);
            latch.countDown();
        });
        Schedule schedule = new Schedule("R3/" + startingSoon() + "/PT0.2S");
        assertTrue(timer.register(Job.newBuilder("job-1").setSchedule(schedule).build()));

        assertTrue(latch.await(3, TimeUnit.SECONDS));
        for (JobTriggerEvent e : events) {
            assertEquals("job-1", e.getJobId());
            assertEquals(schedule, e.getSchedule());
            assertFalse(e.isRunNow());
        }
        Thread.sleep(300);
        assertEquals(3, events.size());
        assertFalse(timer.isRegistered("job-1"));
    }

    @Test
    void invalidScheduleIsTreatedAsScheduleLess() {
        timer = new JobTimer(Clock.systemUTC(), e -> fail("must not fire"));
        assertFalse(timer.register(Job.newBuilder("job-1").setSchedule(new Schedule("not a schedule")).build()));
        assertFalse(timer.isRegistered("job-1"));
    }

    @Test
    void reRegisteringReplacesPendingEntry() throws Exception {
        List<Schedule> fired = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(1);
        timer = new JobTimer(Clock.systemUTC(), e -> {
            fired.add(e.getSchedule());
            latch.countDown();
        });
        Schedule far = new Schedule("R1/2999-01-01T00:00:00Z/PT1S");
        Schedule soon = new Schedule("R1/" + startingSoon() + "/PT1S");
        timer.register(Job.newBuilder("job-1").setSchedule(far).build());
        timer.register(Job.newBuilder("job-1").setSchedule(soon).build());

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(List.of(soon), fired);
    }

    @Test
    void unregisterStopsFiring() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        timer = new JobTimer(Clock.systemUTC(), e -> latch.countDown());
        Instant start = Instant.now().plusMillis(400).truncatedTo(ChronoUnit.MILLIS);
        timer.register(Job.newBuilder("job-1").setSchedule(new Schedule("R1/" + start + "/PT1S")).build());
        assertTrue(timer.unregister("job-1"));
        assertFalse(latch.await(1, TimeUnit.SECONDS));
    }
}
