package io.github.byzatic.jobs.service;

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import io.github.byzatic.jobs.actions.ActionChainExecutor;
import io.github.byzatic.jobs.actions.ActionRegistry;
import io.github.byzatic.jobs.base_exceptions.NotFoundException;
import io.github.byzatic.jobs.config.JobsConfig;
import io.github.byzatic.jobs.model.Action;
import io.github.byzatic.jobs.model.ActionOutput;
import io.github.byzatic.jobs.model.Command;
import io.github.byzatic.jobs.model.CtrlCommand;
import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.JobChangeEvent;
import io.github.byzatic.jobs.model.Schedule;
import io.github.byzatic.jobs.model.Task;
import io.github.byzatic.jobs.model.TaskStatus;
import io.github.byzatic.jobs.schedulers.JobTimer;
import io.github.byzatic.jobs.selectors.SelectorResolver;
import io.github.byzatic.jobs.tasks.CommandAuthorizer;
import io.github.byzatic.jobs.tasks.StuckTaskDetector;
import io.github.byzatic.jobs.tasks.TaskRegistry;
import io.github.byzatic.jobs.tasks.TaskSupervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {
    static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    ExecutorService pool;
    InMemoryJobStore store;
    TaskSupervisor supervisor;
    JobTimer timer;
    StuckTaskDetector detector;
    JobService service;
    Queue<JobChangeEvent> jobEvents;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        store = new InMemoryJobStore();
        jobEvents = new ConcurrentLinkedQueue<>();
        JobsConfig config = new JobsConfig.Builder().stuckSweepInterval(Duration.ZERO).build();
        ActionRegistry actions = new ActionRegistry().register("ok", (action, message, token) -> ActionOutput.success("ok"));
        ActionChainExecutor executor = new ActionChainExecutor(pool, SelectorResolver.newBuilder().build(), actions, Clock.systemUTC());
        ChangeListener listener = new ChangeListener() {
            @Override
            public void onJobChanged(JobChangeEvent event) {
                jobEvents.add(event);
            }
        };
        supervisor = new TaskSupervisor(new TaskRegistry(), store, executor, config, CommandAuthorizer.allowAll(), List.of(listener));
        timer = new JobTimer(Clock.systemUTC(), supervisor::trigger);
        detector = new StuckTaskDetector(supervisor, config);
        service = new JobService(store, supervisor, timer, detector);
    }

    @AfterEach
    void tearDown() {
        timer.close();
        supervisor.close();
        pool.shutdownNow();
    }

    private static Job.Builder job(String id) {
        return Job.newBuilder(id).addActions(Action.newBuilder("ok").build());
    }

    private static Task ended(String id, String jobId, TaskStatus status, int minutes) {
        return Task.newBuilder(id, jobId).setStatus(status)
                .setStartTime(T0.plusSeconds(minutes * 60L - 30))
                .setEndTime(T0.plusSeconds(minutes * 60L))
                .build();
    }

    private static void waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long end = System.currentTimeMillis() + timeout.toMillis();
        while (System.currentTimeMillis() < end) {
            if (condition.getAsBoolean()) return;
            Thread.sleep(20);
        }
        fail("Condition not met within " + timeout.toMillis() + " ms");
    }

    @Test
    void pruneKeepsMostRecentTasksPerJob() {
        service.putJob(job("a").build());
        service.putJob(job("b").build());
        for (int i = 0; i < 8; i++) store.putTask(ended("a-" + i, "a", TaskStatus.FINISHED, i));
        store.putTask(ended("a-err", "a", TaskStatus.ERROR, 1));
        for (int i = 0; i < 3; i++) store.putTask(ended("b-" + i, "b", TaskStatus.FINISHED, i));

        List<String> deleted = service.deleteTasks(DeleteTasksRequest.newBuilder()
                .addStatuses(TaskStatus.FINISHED).setPruneLimit(5).build());

        assertEquals(List.of("a-2", "a-1", "a-0"), deleted);
        assertTrue(store.getTask("a-3").isPresent());
        assertTrue(store.getTask("a-7").isPresent());
        assertTrue(store.getTask("a-err").isPresent());
        assertEquals(3, store.listTasks("b").size());
    }

    @Test
    void unfinishedTasksSortLast() {
        Task running = Task.newBuilder("r", "a").setStatus(TaskStatus.RUNNING).setStartTime(T0.plusSeconds(9999)).build();
        List<Task> sorted = Lists.newArrayList(running, ended("old", "a", TaskStatus.FINISHED, 1), ended("new", "a", TaskStatus.FINISHED, 5));
        sorted.sort(JobService.MOST_RECENT_FIRST);
        assertEquals(List.of("new", "old", "r"), sorted.stream().map(Task::getId).collect(Collectors.toList()));
    }

    @Test
    void deleteTasksByIdHonorsJob() {
        service.putJob(job("a").build());
        service.putJob(job("b").build());
        store.putTask(ended("a-1", "a", TaskStatus.FINISHED, 1));
        store.putTask(ended("b-1", "b", TaskStatus.FINISHED, 1));

        List<String> deleted = service.deleteTasks(DeleteTasksRequest.newBuilder()
                .setJobId("a").addTaskIds("a-1", "b-1", "missing").build());

        assertEquals(List.of("a-1"), deleted);
        assertTrue(store.getTask("b-1").isPresent());
    }

    @Test
    void listJobsAppliesFilters() {
        service.putJob(job("events").setOwner("alice").addEventNames("file.created").build());
        service.putJob(job("timed").setOwner("bob").setSchedule(new Schedule("R/2099-01-01T00:00:00Z/PT1H")).build());
        service.putJob(job("plain").setOwner("alice").build());
        store.putTask(ended("e-1", "events", TaskStatus.FINISHED, 1));
        store.putTask(ended("e-2", "events", TaskStatus.ERROR, 2));

        assertEquals(3, Iterators.size(service.listJobs(ListJobsRequest.all())));
        assertEquals(List.of("events", "plain"), ids(service.listJobs(ListJobsRequest.newBuilder().setOwner("alice").build())));
        assertEquals(List.of("events"), ids(service.listJobs(ListJobsRequest.newBuilder().setEventsOnly(true).build())));
        assertEquals(List.of("timed"), ids(service.listJobs(ListJobsRequest.newBuilder().setTimersOnly(true).build())));
        assertEquals(List.of("plain"), ids(service.listJobs(ListJobsRequest.newBuilder().addJobIds("plain", "nope").build())));

        Job withErrors = service.listJobs(ListJobsRequest.newBuilder().addJobIds("events").setLoadTasks(TaskStatus.ERROR).build()).next();
        assertEquals(List.of("e-2"), withErrors.getTasks().stream().map(Task::getId).collect(Collectors.toList()));
        Job page = service.listJobs(ListJobsRequest.newBuilder().addJobIds("events").setLoadTasks(TaskStatus.ANY)
                .setTasksOffset(1).setTasksLimit(1).build()).next();
        assertEquals(List.of("e-2"), page.getTasks().stream().map(Task::getId).collect(Collectors.toList()));
    }

    private static List<String> ids(Iterator<Job> jobs) {
        return Lists.newArrayList(jobs).stream().map(Job::getId).collect(Collectors.toList());
    }

    @Test
    void getJobLoadsTasksOnRequest() throws Exception {
        service.putJob(job("a").build());
        store.putTask(ended("a-1", "a", TaskStatus.FINISHED, 1));

        assertTrue(service.getJob("a", null).getTasks().isEmpty());
        assertEquals(1, service.getJob("a", TaskStatus.ANY).getTasks().size());
        assertTrue(service.getJob("a", TaskStatus.ERROR).getTasks().isEmpty());
        assertThrows(NotFoundException.class, () -> service.getJob("nope", null));
    }

    @Test
    void putJobRegistersScheduleAndSkipsMalformedOne() {
        service.putJob(job("timed").setSchedule(new Schedule("R/2099-01-01T00:00:00Z/PT1H")).build());
        assertTrue(timer.isRegistered("timed"));

        Job broken = service.putJob(job("broken").setSchedule(new Schedule("every tuesday")).build());
        assertEquals("broken", broken.getId());
        assertTrue(store.getJob("broken").isPresent());
        assertFalse(timer.isRegistered("broken"));

        service.putJob(job("timed").build());
        assertFalse(timer.isRegistered("timed"));
        assertTrue(jobEvents.stream().anyMatch(e -> !e.isRemoval() && e.getJobUpdated().getId().equals("broken")));
    }

    @Test
    void autoStartAndAutoClean() throws Exception {
        service.putJob(job("once").setAutoStart(true).setAutoClean(true).build());

        waitUntil(() -> store.getJob("once").isEmpty(), Duration.ofSeconds(5));
        assertTrue(store.listTasks("once").isEmpty());
        assertTrue(jobEvents.stream().anyMatch(e -> e.isRemoval() && e.getJobRemoved().equals("once")));
    }

    @Test
    void deleteJobRemovesTasksAndCleansEligibleJobs() throws Exception {
        service.putJob(job("target").setSchedule(new Schedule("R/2099-01-01T00:00:00Z/PT1H")).build());
        store.putTask(ended("t-1", "target", TaskStatus.FINISHED, 1));
        service.putJob(job("cleanable").setAutoClean(true).build());
        store.putTask(ended("c-1", "cleanable", TaskStatus.FINISHED, 1));
        store.putTask(ended("c-2", "cleanable", TaskStatus.ERROR, 2));
        service.putJob(job("failed").setAutoClean(true).build());
        store.putTask(ended("f-1", "failed", TaskStatus.ERROR, 1));
        service.putJob(job("kept").build());
        store.putTask(ended("k-1", "kept", TaskStatus.FINISHED, 1));

        assertEquals(1, service.deleteJob("target", false));
        assertTrue(store.getJob("target").isEmpty());
        assertTrue(store.getTask("t-1").isEmpty());
        assertFalse(timer.isRegistered("target"));

        assertEquals(1, service.deleteJob("", true));
        assertTrue(store.getJob("cleanable").isEmpty());
        assertTrue(store.getJob("failed").isPresent());
        assertTrue(store.getJob("kept").isPresent());

        assertThrows(NotFoundException.class, () -> service.deleteJob("target", false));
        assertThrows(NotFoundException.class, () -> service.deleteJob("", false));
    }

    @Test
    void putTasksIsLazy() {
        service.putJob(job("a").build());
        Iterator<Task> stored = service.putTasks(List.of(ended("a-1", "a", TaskStatus.FINISHED, 1),
                ended("a-2", "a", TaskStatus.FINISHED, 2)).iterator());

        assertTrue(store.listTasks("a").isEmpty());
        assertEquals("a-1", stored.next().getId());
        assertEquals(1, store.listTasks("a").size());
        stored.next();
        assertEquals(2, Iterators.size(service.listTasks("a", TaskStatus.FINISHED)));
        assertEquals(0, Iterators.size(service.listTasks("a", TaskStatus.ERROR)));
        assertEquals(2, Iterators.size(service.listTasks(null, null)));
    }

    @Test
    void stuckDetectionAndControlGoThroughTheService() throws Exception {
        service.putJob(job("legacy").build());
        Instant hourAgo = Instant.now().minusSeconds(3600);
        store.putTask(Task.newBuilder("stale", "legacy").setStatus(TaskStatus.RUNNING)
                .setStartTime(hourAgo).setLastUpdate(hourAgo).build());

        assertEquals(List.of("stale"), service.detectStuckTasks(600));
        assertEquals(TaskStatus.INTERRUPTED, store.getTask("stale").get().getStatus());

        service.control(CtrlCommand.forJob(Command.INACTIVE, "legacy", ""));
        assertTrue(store.getJob("legacy").get().isInactive());
    }
}
