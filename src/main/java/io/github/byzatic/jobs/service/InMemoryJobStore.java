package io.github.byzatic.jobs.service;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.Task;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@ThreadSafe
public final class InMemoryJobStore implements JobStore {
    @GuardedBy("this")
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    @GuardedBy("this")
    private final Map<String, Task> tasks = new LinkedHashMap<>();

    @Override
    public synchronized @NotNull Optional<Job> getJob(@NotNull String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized void putJob(@NotNull Job job) {
        jobs.put(job.getId(), job.getTasks().isEmpty() ? job : job.withTasks(List.of()));
    }

    @Override
    public synchronized boolean deleteJob(@NotNull String jobId) {
        tasks.values().removeIf(t -> t.getJobId().equals(jobId));
        return jobs.remove(jobId) != null;
    }

    @Override
    public synchronized @NotNull List<Job> listJobs() {
        return ImmutableList.copyOf(jobs.values());
    }

    @Override
    public synchronized @NotNull Optional<Task> getTask(@NotNull String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public synchronized void putTask(@NotNull Task task) {
        tasks.put(task.getId(), task);
    }

    @Override
    public synchronized boolean deleteTask(@NotNull String taskId) {
        return tasks.remove(taskId) != null;
    }

    @Override
    public synchronized @NotNull List<Task> listTasks(@Nullable String jobId) {
        ImmutableList.Builder<Task> out = ImmutableList.builder();
        for (Task task : tasks.values()) {
            if (jobId == null || jobId.equals(task.getJobId())) out.add(task);
        }
        return out.build();
    }
}
