package io.github.byzatic.jobs.service;

import com.google.common.collect.ImmutableSet;
import io.github.byzatic.jobs.model.TaskStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Set;

/**
 * Filters of {@link JobService#listJobs(ListJobsRequest)}. Empty fields do not filter.
 */
public final class ListJobsRequest {
    private final String owner;
    private final boolean eventsOnly;
    private final boolean timersOnly;
    private final TaskStatus loadTasks;
    private final ImmutableSet<String> jobIds;
    private final int tasksOffset;
    private final int tasksLimit;

    private ListJobsRequest(Builder builder) {
        this.owner = builder.owner;
        this.eventsOnly = builder.eventsOnly;
        this.timersOnly = builder.timersOnly;
        this.loadTasks = builder.loadTasks;
        this.jobIds = builder.jobIds.build();
        this.tasksOffset = builder.tasksOffset;
        this.tasksLimit = builder.tasksLimit;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static ListJobsRequest all() {
        return new Builder().build();
    }

    public @NotNull String getOwner() {
        return owner;
    }

    public boolean isEventsOnly() {
        return eventsOnly;
    }

    public boolean isTimersOnly() {
        return timersOnly;
    }

    /**
     * Status of the tasks to attach to each job, null for none.
     */
    public @Nullable TaskStatus getLoadTasks() {
        return loadTasks;
    }

    public @NotNull Set<String> getJobIds() {
        return jobIds;
    }

    public int getTasksOffset() {
        return tasksOffset;
    }

    /**
     * 0 for no limit.
     */
    public int getTasksLimit() {
        return tasksLimit;
    }

    public static final class Builder {
        private String owner = "";
        private boolean eventsOnly;
        private boolean timersOnly;
        private TaskStatus loadTasks;
        private final ImmutableSet.Builder<String> jobIds = ImmutableSet.builder();
        private int tasksOffset;
        private int tasksLimit;

        public Builder setOwner(String owner) {
            this.owner = owner == null ? "" : owner;
            return this;
        }

        public Builder setEventsOnly(boolean eventsOnly) {
            this.eventsOnly = eventsOnly;
            return this;
        }

        public Builder setTimersOnly(boolean timersOnly) {
            this.timersOnly = timersOnly;
            return this;
        }

        public Builder setLoadTasks(TaskStatus loadTasks) {
            this.loadTasks = loadTasks;
            return this;
        }

        public Builder addJobIds(String... jobIds) {
            this.jobIds.addAll(Arrays.asList(jobIds));
            return this;
        }

        public Builder setTasksOffset(int tasksOffset) {
            this.tasksOffset = Math.max(0, tasksOffset);
            return this;
        }

        public Builder setTasksLimit(int tasksLimit) {
            this.tasksLimit = Math.max(0, tasksLimit);
            return this;
        }

        public ListJobsRequest build() {
            return new ListJobsRequest(this);
        }
    }
}
