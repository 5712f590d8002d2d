package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Operator instruction targeting a job or one of its tasks.
 */
public final class CtrlCommand {
    private final Command cmd;
    private final String jobId;
    private final String taskId;
    private final String ownerId;

    public CtrlCommand(Command cmd, String jobId, String taskId, String ownerId) {
        this.cmd = cmd == null ? Command.NONE : cmd;
        this.jobId = jobId == null ? "" : jobId;
        this.taskId = taskId == null ? "" : taskId;
        this.ownerId = ownerId == null ? "" : ownerId;
    }

    public static CtrlCommand forTask(Command cmd, String jobId, String taskId, String ownerId) {
        return new CtrlCommand(cmd, jobId, taskId, ownerId);
    }

    public static CtrlCommand forJob(Command cmd, String jobId, String ownerId) {
        return new CtrlCommand(cmd, jobId, "", ownerId);
    }

    public @NotNull Command getCmd() {
        return cmd;
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull String getTaskId() {
        return taskId;
    }

    public @NotNull String getOwnerId() {
        return ownerId;
    }

    public boolean hasTaskId() {
        return !taskId.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CtrlCommand that = (CtrlCommand) o;
        return cmd == that.cmd && jobId.equals(that.jobId) && taskId.equals(that.taskId) && ownerId.equals(that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cmd, jobId, taskId, ownerId);
    }

    @Override
    public String toString() {
        return "CtrlCommand{" + cmd + ", jobId='" + jobId + "', taskId='" + taskId + "', ownerId='" + ownerId + "'}";
    }
}
