package io.github.byzatic.jobs.service;

import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.Task;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Persistent store of job definitions and task records. Implementations must be thread-safe.
 * Jobs are stored without their transient task list.
 */
public interface JobStore {

    @NotNull Optional<Job> getJob(@NotNull String jobId);

    void putJob(@NotNull Job job);

    /**
     * Removes the job and all its tasks.
     */
    boolean deleteJob(@NotNull String jobId);

    /**
     * All jobs, in insertion order.
     */
    @NotNull List<Job> listJobs();

    @NotNull Optional<Task> getTask(@NotNull String taskId);

    void putTask(@NotNull Task task);

    boolean deleteTask(@NotNull String taskId);

    /**
     * Tasks of one job, or of every job when {@code jobId} is null, in insertion order.
     */
    @NotNull List<Task> listTasks(@Nullable String jobId);
}
