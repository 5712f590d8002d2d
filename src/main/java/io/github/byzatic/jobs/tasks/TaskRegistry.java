package io.github.byzatic.jobs.tasks;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live tasks and concurrency slots of every job. One registry per supervisor.
 */
@ThreadSafe
public final class TaskRegistry {
    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final Map<String, JobSlots> slots = new ConcurrentHashMap<>();

    void add(TaskRecord rec) {
        tasks.put(rec.taskId, rec);
    }

    void remove(TaskRecord rec) {
        tasks.remove(rec.taskId, rec);
    }

    JobSlots slots(String jobId) {
        return slots.computeIfAbsent(jobId, JobSlots::new);
    }

    public @NotNull Optional<TaskRecord> get(@NotNull String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public @NotNull List<TaskRecord> all() {
        return ImmutableList.copyOf(tasks.values());
    }

    public @NotNull List<TaskRecord> ofJob(@NotNull String jobId) {
        ImmutableList.Builder<TaskRecord> out = ImmutableList.builder();
        for (TaskRecord rec : tasks.values()) {
            if (rec.getJobId().equals(jobId)) out.add(rec);
        }
        return out.build();
    }

    /**
     * Tasks of the job holding a slot, running or paused.
     */
    public int runningCount(@NotNull String jobId) {
        JobSlots s = slots.get(jobId);
        return s == null ? 0 : s.running();
    }

    public int queuedCount(@NotNull String jobId) {
        JobSlots s = slots.get(jobId);
        return s == null ? 0 : s.queued();
    }

    public int size() {
        return tasks.size();
    }
}
