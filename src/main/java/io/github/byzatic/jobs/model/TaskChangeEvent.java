package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public final class TaskChangeEvent {
    private final Task taskUpdated;
    private final Job job;

    public TaskChangeEvent(@NotNull Task taskUpdated, @NotNull Job job) {
        this.taskUpdated = Objects.requireNonNull(taskUpdated);
        this.job = Objects.requireNonNull(job);
    }

    public @NotNull Task getTaskUpdated() {
        return taskUpdated;
    }

    public @NotNull Job getJob() {
        return job;
    }

    @Override
    public String toString() {
        return "TaskChangeEvent{task=" + taskUpdated + ", job='" + job.getId() + "'}";
    }
}
