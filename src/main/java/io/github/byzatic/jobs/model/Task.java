package io.github.byzatic.jobs.model;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one execution of a job.
 */
public final class Task {
    private final String id;
    private final String jobId;
    private final TaskStatus status;
    private final String statusMessage;
    private final String triggerOwner;
    private final Instant startTime;
    private final Instant endTime;
    private final boolean canStop;
    private final boolean canPause;
    private final boolean hasProgress;
    private final float progress;
    private final ImmutableList<ActionLog> actionsLogs;
    private final Instant lastUpdate;

    private Task(Builder builder) {
        this.id = builder.id;
        this.jobId = builder.jobId;
        this.status = builder.status;
        this.statusMessage = builder.statusMessage;
        this.triggerOwner = builder.triggerOwner;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.canStop = builder.canStop;
        this.canPause = builder.canPause;
        this.hasProgress = builder.hasProgress;
        this.progress = builder.progress;
        this.actionsLogs = ImmutableList.copyOf(builder.actionsLogs);
        this.lastUpdate = builder.lastUpdate;
    }

    public static Builder newBuilder(@NotNull String id, @NotNull String jobId) {
        return new Builder(id, jobId);
    }

    public static Builder newBuilder(Task copy) {
        Builder builder = new Builder(copy.id, copy.jobId);
        builder.status = copy.status;
        builder.statusMessage = copy.statusMessage;
        builder.triggerOwner = copy.triggerOwner;
        builder.startTime = copy.startTime;
        builder.endTime = copy.endTime;
        builder.canStop = copy.canStop;
        builder.canPause = copy.canPause;
        builder.hasProgress = copy.hasProgress;
        builder.progress = copy.progress;
        builder.actionsLogs = copy.actionsLogs;
        builder.lastUpdate = copy.lastUpdate;
        return builder;
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull TaskStatus getStatus() {
        return status;
    }

    public @NotNull String getStatusMessage() {
        return statusMessage;
    }

    public @NotNull String getTriggerOwner() {
        return triggerOwner;
    }

    public @Nullable Instant getStartTime() {
        return startTime;
    }

    public @Nullable Instant getEndTime() {
        return endTime;
    }

    public boolean isCanStop() {
        return canStop;
    }

    public boolean isCanPause() {
        return canPause;
    }

    public boolean isHasProgress() {
        return hasProgress;
    }

    /**
     * Between 0 and 1.
     */
    public float getProgress() {
        return progress;
    }

    public @NotNull List<ActionLog> getActionsLogs() {
        return actionsLogs;
    }

    public @Nullable Instant getLastUpdate() {
        return lastUpdate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task task = (Task) o;
        return canStop == task.canStop && canPause == task.canPause && hasProgress == task.hasProgress
                && Float.compare(task.progress, progress) == 0 && id.equals(task.id) && jobId.equals(task.jobId)
                && status == task.status && statusMessage.equals(task.statusMessage)
                && triggerOwner.equals(task.triggerOwner) && Objects.equals(startTime, task.startTime)
                && Objects.equals(endTime, task.endTime) && actionsLogs.equals(task.actionsLogs)
                && Objects.equals(lastUpdate, task.lastUpdate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, jobId, status, statusMessage, triggerOwner, startTime, endTime, canStop, canPause,
                hasProgress, progress, actionsLogs, lastUpdate);
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", jobId='" + jobId + '\'' +
                ", status=" + status +
                (statusMessage.isEmpty() ? "" : ", statusMessage='" + statusMessage + '\'') +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                ", progress=" + progress +
                ", logs=" + actionsLogs.size() +
                '}';
    }

    public static final class Builder {
        private final String id;
        private final String jobId;
        private TaskStatus status = TaskStatus.IDLE;
        private String statusMessage = "";
        private String triggerOwner = "";
        private Instant startTime;
        private Instant endTime;
        private boolean canStop = true;
        private boolean canPause = true;
        private boolean hasProgress = true;
        private float progress;
        private List<ActionLog> actionsLogs = ImmutableList.of();
        private Instant lastUpdate;

        private Builder(String id, String jobId) {
            this.id = Objects.requireNonNull(id);
            this.jobId = Objects.requireNonNull(jobId);
        }

        public Builder setStatus(TaskStatus status) {
            this.status = Objects.requireNonNull(status);
            return this;
        }

        public Builder setStatusMessage(String statusMessage) {
            this.statusMessage = statusMessage == null ? "" : statusMessage;
            return this;
        }

        public Builder setTriggerOwner(String triggerOwner) {
            this.triggerOwner = triggerOwner == null ? "" : triggerOwner;
            return this;
        }

        public Builder setStartTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder setEndTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder setCanStop(boolean canStop) {
            this.canStop = canStop;
            return this;
        }

        public Builder setCanPause(boolean canPause) {
            this.canPause = canPause;
            return this;
        }

        public Builder setHasProgress(boolean hasProgress) {
            this.hasProgress = hasProgress;
            return this;
        }

        public Builder setProgress(float progress) {
            this.progress = Math.max(0f, Math.min(1f, progress));
            return this;
        }

        public Builder setActionsLogs(List<ActionLog> actionsLogs) {
            this.actionsLogs = Objects.requireNonNull(actionsLogs);
            return this;
        }

        public Builder setLastUpdate(Instant lastUpdate) {
            this.lastUpdate = lastUpdate;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
