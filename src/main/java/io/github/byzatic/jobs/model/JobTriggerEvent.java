package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Signal asking to start a job now, sent by the timer or by an operator.
 */
public final class JobTriggerEvent {
    private final String jobId;
    private final Schedule schedule;
    private final boolean runNow;

    public JobTriggerEvent(@NotNull String jobId, @Nullable Schedule schedule, boolean runNow) {
        this.jobId = Objects.requireNonNull(jobId);
        this.schedule = schedule;
        this.runNow = runNow;
    }

    public static @NotNull JobTriggerEvent runNow(@NotNull String jobId) {
        return new JobTriggerEvent(jobId, null, true);
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    /**
     * Snapshot of the schedule that produced this trigger, null when sent by hand.
     */
    public @Nullable Schedule getSchedule() {
        return schedule;
    }

    public boolean isRunNow() {
        return runNow;
    }

    @Override
    public String toString() {
        return "JobTriggerEvent{jobId='" + jobId + "', schedule=" + schedule + ", runNow=" + runNow + '}';
    }
}
