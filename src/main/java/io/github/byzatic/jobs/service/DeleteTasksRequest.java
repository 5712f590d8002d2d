package io.github.byzatic.jobs.service;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.byzatic.jobs.model.TaskStatus;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Tasks to delete: an explicit ID list, or every task with one of the statuses, optionally keeping
 * the {@code pruneLimit} most recent ones of each job. A job ID restricts both forms to that job.
 */
public final class DeleteTasksRequest {
    private final String jobId;
    private final ImmutableList<String> taskIds;
    private final ImmutableSet<TaskStatus> statuses;
    private final int pruneLimit;

    private DeleteTasksRequest(Builder builder) {
        this.jobId = builder.jobId;
        this.taskIds = builder.taskIds.build();
        this.statuses = builder.statuses.build();
        this.pruneLimit = builder.pruneLimit;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull List<String> getTaskIds() {
        return taskIds;
    }

    public @NotNull Set<TaskStatus> getStatuses() {
        return statuses;
    }

    public int getPruneLimit() {
        return pruneLimit;
    }

    public static final class Builder {
        private String jobId = "";
        private final ImmutableList.Builder<String> taskIds = ImmutableList.builder();
        private final ImmutableSet.Builder<TaskStatus> statuses = ImmutableSet.builder();
        private int pruneLimit;

        public Builder setJobId(String jobId) {
            this.jobId = jobId == null ? "" : jobId;
            return this;
        }

        public Builder addTaskIds(String... taskIds) {
            this.taskIds.addAll(Arrays.asList(taskIds));
            return this;
        }

        public Builder addStatuses(TaskStatus... statuses) {
            this.statuses.addAll(Arrays.asList(statuses));
            return this;
        }

        public Builder setPruneLimit(int pruneLimit) {
            this.pruneLimit = Math.max(0, pruneLimit);
            return this;
        }

        public DeleteTasksRequest build() {
            return new DeleteTasksRequest(this);
        }
    }
}
