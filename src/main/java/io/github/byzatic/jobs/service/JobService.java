package io.github.byzatic.jobs.service;

import com.google.common.collect.Iterators;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.base_exceptions.InvalidStateException;
import io.github.byzatic.jobs.base_exceptions.NotFoundException;
import io.github.byzatic.jobs.base_exceptions.PermissionException;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.CtrlCommand;
import io.github.byzatic.jobs.model.CtrlCommandResponse;
import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.JobChangeEvent;
import io.github.byzatic.jobs.model.Task;
import io.github.byzatic.jobs.model.TaskStatus;
import io.github.byzatic.jobs.schedulers.JobTimer;
import io.github.byzatic.jobs.tasks.FiringSource;
import io.github.byzatic.jobs.tasks.StuckTaskDetector;
import io.github.byzatic.jobs.tasks.TaskSupervisor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Job and task operations exposed to callers: CRUD on jobs and tasks, stuck-task detection and control.
 */
@ThreadSafe
public final class JobService {
    private final static Logger logger = LoggerFactory.getLogger(JobService.class);

    private static final Comparator<Instant> LATEST_FIRST = Comparator.nullsLast(Comparator.<Instant>reverseOrder());
    static final Comparator<Task> MOST_RECENT_FIRST = Comparator
            .comparing(Task::getEndTime, LATEST_FIRST)
            .thenComparing(Task::getStartTime, LATEST_FIRST);

    private final JobStore store;
    private final TaskSupervisor supervisor;
    private final JobTimer timer;
    private final StuckTaskDetector detector;

    public JobService(@NotNull JobStore store, @NotNull TaskSupervisor supervisor, @NotNull JobTimer timer, @NotNull StuckTaskDetector detector) {
        this.store = Objects.requireNonNull(store);
        this.supervisor = Objects.requireNonNull(supervisor);
        this.timer = Objects.requireNonNull(timer);
        this.detector = Objects.requireNonNull(detector);
    }

    // ======== Jobs ========

    /**
     * Stores the job, (re)registers its schedule and starts a task when the job auto-starts.
     * A malformed schedule is logged and the job stays schedule-less.
     */
    public @NotNull Job putJob(@NotNull Job job) {
        if (job.getId().isEmpty()) throw new IllegalArgumentException("Job ID is required");
        Job stored = job.withTasks(List.of());
        store.putJob(stored);
        supervisor.publishJobChange(JobChangeEvent.updated(stored));
        timer.register(stored);
        logger.info("Job {} ({}) stored", stored.getId(), stored.getLabel());
        if (stored.isAutoStart()) {
            supervisor.fire(stored, ActionMessage.empty(), stored.getOwner(), FiringSource.AUTO_START);
        }
        return stored;
    }

    /**
     * @param loadTasks status of the tasks to attach, null for none, {@link TaskStatus#ANY} for all
     */
    public @NotNull Job getJob(@NotNull String jobId, @Nullable TaskStatus loadTasks) throws NotFoundException {
        Job job = store.getJob(jobId).orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
        return loadTasks == null ? job : job.withTasks(tasksOf(jobId, loadTasks, 0, 0));
    }

    /**
     * Deletes a job with its tasks, stopping the live ones. With {@code cleanableJobs}, also deletes
     * every auto-clean job whose tasks all ended and one of them finished.
     *
     * @param jobId job to delete, may be empty when cleaning
     * @return number of deleted jobs
     */
    public int deleteJob(@NotNull String jobId, boolean cleanableJobs) throws NotFoundException {
        int deleted = 0;
        if (!jobId.isEmpty()) {
            if (store.getJob(jobId).isEmpty()) throw new NotFoundException("Job not found: " + jobId);
            remove(jobId);
            deleted++;
        } else if (!cleanableJobs) {
            throw new NotFoundException("No job to delete");
        }
        if (cleanableJobs) {
            for (Job job : store.listJobs()) {
                if (job.isAutoClean() && isCleanable(job.getId())) {
                    remove(job.getId());
                    deleted++;
                }
            }
        }
        return deleted;
    }

    private boolean isCleanable(String jobId) {
        if (!supervisor.getRegistry().ofJob(jobId).isEmpty()) return false;
        List<Task> tasks = store.listTasks(jobId);
        return tasks.stream().allMatch(t -> t.getStatus().isTerminal())
                && tasks.stream().anyMatch(t -> t.getStatus() == TaskStatus.FINISHED);
    }

    private void remove(String jobId) {
        timer.unregister(jobId);
        int stopped = supervisor.stopAll(jobId, "Job deleted");
        store.deleteJob(jobId);
        supervisor.publishJobChange(JobChangeEvent.removed(jobId));
        logger.info("Job {} deleted, {} live task(s) stopped", jobId, stopped);
    }

    /**
     * Jobs matching the request, read lazily from the store.
     */
    public @NotNull Iterator<Job> listJobs(@NotNull ListJobsRequest request) {
        Iterator<Job> matching = Iterators.filter(store.listJobs().iterator(), job -> {
            if (!request.getOwner().isEmpty() && !request.getOwner().equals(job.getOwner())) return false;
            if (request.isEventsOnly() && job.getEventNames().isEmpty()) return false;
            if (request.isTimersOnly() && !job.hasSchedule()) return false;
            return request.getJobIds().isEmpty() || request.getJobIds().contains(job.getId());
        });
        if (request.getLoadTasks() == null) return matching;
        return Iterators.transform(matching, job -> job.withTasks(
                tasksOf(job.getId(), request.getLoadTasks(), request.getTasksOffset(), request.getTasksLimit())));
    }

    private List<Task> tasksOf(String jobId, TaskStatus status, int offset, int limit) {
        return store.listTasks(jobId).stream()
                .filter(t -> t.getStatus().matches(status))
                .skip(offset)
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .collect(Collectors.toList());
    }

    // ======== Tasks ========

    public @NotNull Task putTask(@NotNull Task task) {
        store.putTask(task);
        store.getJob(task.getJobId()).ifPresent(job -> supervisor.publishTaskChange(task, job));
        return task;
    }

    /**
     * Stores each task as the returned iterator reaches it.
     */
    public @NotNull Iterator<Task> putTasks(@NotNull Iterator<Task> tasks) {
        return Iterators.transform(tasks, this::putTask);
    }

    /**
     * @param jobId  null for the tasks of every job
     * @param status null or {@link TaskStatus#ANY} for every status
     */
    public @NotNull Iterator<Task> listTasks(@Nullable String jobId, @Nullable TaskStatus status) {
        return Iterators.filter(store.listTasks(jobId == null || jobId.isEmpty() ? null : jobId).iterator(),
                t -> t.getStatus().matches(status));
    }

    /**
     * @return IDs of the deleted tasks
     */
    public @NotNull List<String> deleteTasks(@NotNull DeleteTasksRequest request) {
        List<String> deleted = new ArrayList<>();
        String jobId = request.getJobId();
        if (!request.getTaskIds().isEmpty()) {
            for (String taskId : request.getTaskIds()) {
                if (!jobId.isEmpty() && store.getTask(taskId).filter(t -> t.getJobId().equals(jobId)).isEmpty()) continue;
                if (delete(taskId)) deleted.add(taskId);
            }
            return deleted;
        }
        if (request.getStatuses().isEmpty()) return deleted;

        Map<String, List<Task>> byJob = new LinkedHashMap<>();
        for (Task task : store.listTasks(jobId.isEmpty() ? null : jobId)) {
            if (request.getStatuses().stream().anyMatch(s -> task.getStatus().matches(s))) {
                byJob.computeIfAbsent(task.getJobId(), k -> new ArrayList<>()).add(task);
            }
        }
        for (List<Task> tasks : byJob.values()) {
            tasks.sort(MOST_RECENT_FIRST);
            for (Task task : tasks.subList(Math.min(request.getPruneLimit(), tasks.size()), tasks.size())) {
                if (delete(task.getId())) deleted.add(task.getId());
            }
        }
        logger.debug("Deleted {} task(s) for {}", deleted.size(), request.getStatuses());
        return deleted;
    }

    private boolean delete(String taskId) {
        try {
            return supervisor.deleteTask(taskId, "Task deleted");
        } catch (InvalidStateException e) {
            logger.warn("Task {} not deleted: {}", taskId, e.getMessage());
            return false;
        }
    }

    // ======== Supervision ========

    /**
     * @return IDs of the running tasks interrupted for having no update since {@code sinceSeconds}
     */
    public @NotNull List<String> detectStuckTasks(int sinceSeconds) {
        return detector.sweep(sinceSeconds);
    }

    public @NotNull CtrlCommandResponse control(@NotNull CtrlCommand command) throws NotFoundException, PermissionException, InvalidStateException {
        return supervisor.control(command);
    }
}
