package io.github.byzatic.jobs.tasks;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobs.model.ActionLog;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.Task;
import io.github.byzatic.jobs.model.TaskStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Live state of one task, from its firing until it is terminal.
 * Status changes that move a concurrency slot are made by {@link JobSlots} with both monitors held.
 */
@ThreadSafe
public final class TaskRecord {
    final String taskId;
    final Job job;
    final ActionMessage message;
    final String triggerOwner;
    final CancellationToken token = new CancellationToken();
    final boolean canStop;
    final boolean canPause;
    final boolean hasProgress;

    @GuardedBy("this")
    private TaskStatus status = TaskStatus.IDLE;
    @GuardedBy("this")
    private String statusMessage = TaskStatus.getStatusMessage(TaskStatus.IDLE);
    @GuardedBy("this")
    private Instant startTime;
    @GuardedBy("this")
    private Instant endTime;
    @GuardedBy("this")
    private Instant lastUpdate;
    @GuardedBy("this")
    private float progress;
    @GuardedBy("this")
    private final List<ActionLog> logs = new ArrayList<>();
    @GuardedBy("this")
    private boolean holdsSlot;
    volatile CompletableFuture<?> runningFuture;

    /**
     * Orders the store writes and notifications of this record. Taken before the record monitor.
     */
    final Object writeLock = new Object();
    @GuardedBy("writeLock")
    boolean terminalWritten;

    TaskRecord(String taskId, Job job, ActionMessage message, String triggerOwner,
               boolean canStop, boolean canPause, boolean hasProgress, Instant now) {
        this.taskId = taskId;
        this.job = job;
        this.message = message;
        this.triggerOwner = triggerOwner == null ? "" : triggerOwner;
        this.canStop = canStop;
        this.canPause = canPause;
        this.hasProgress = hasProgress;
        this.lastUpdate = now;
    }

    public @NotNull String getTaskId() {
        return taskId;
    }

    public @NotNull String getJobId() {
        return job.getId();
    }

    public @NotNull Job getJob() {
        return job;
    }

    public synchronized @NotNull TaskStatus getStatus() {
        return status;
    }

    public synchronized @Nullable Instant getLastUpdate() {
        return lastUpdate;
    }

    synchronized boolean holdsSlot() {
        return holdsSlot;
    }

    synchronized void transition(TaskStatus next, String message, Instant now) {
        status = next;
        statusMessage = message == null ? TaskStatus.getStatusMessage(next) : message;
        lastUpdate = now;
        if (next == TaskStatus.RUNNING && startTime == null) startTime = now;
        if (next.isTerminal()) endTime = now;
    }

    synchronized void acquireSlot(Instant now) {
        holdsSlot = true;
        transition(TaskStatus.RUNNING, null, now);
    }

    /**
     * @return true when the record held a slot
     */
    synchronized boolean releaseSlot() {
        boolean held = holdsSlot;
        holdsSlot = false;
        return held;
    }

    /**
     * @return false when the task is already terminal and the log is dropped
     */
    synchronized boolean appendLog(ActionLog log, float progress, Instant now) {
        if (status.isTerminal()) return false;
        logs.add(log);
        if (hasProgress) this.progress = progress;
        lastUpdate = now;
        return true;
    }

    synchronized void setProgress(float progress) {
        if (hasProgress) this.progress = progress;
    }

    public synchronized @NotNull Task snapshot() {
        return Task.newBuilder(taskId, job.getId())
                .setStatus(status)
                .setStatusMessage(statusMessage)
                .setTriggerOwner(triggerOwner)
                .setStartTime(startTime)
                .setEndTime(endTime)
                .setCanStop(canStop)
                .setCanPause(canPause)
                .setHasProgress(hasProgress)
                .setProgress(progress)
                .setActionsLogs(ImmutableList.copyOf(logs))
                .setLastUpdate(lastUpdate)
                .build();
    }

    @Override
    public String toString() {
        return "TaskRecord{" +
                "taskId='" + taskId + '\'' +
                ", jobId='" + job.getId() + '\'' +
                ", status=" + getStatus() +
                '}';
    }
}
