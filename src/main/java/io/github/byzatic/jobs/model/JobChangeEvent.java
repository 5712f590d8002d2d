package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Either an updated job or the ID of a removed one.
 */
public final class JobChangeEvent {
    private final Job jobUpdated;
    private final String jobRemoved;

    private JobChangeEvent(Job jobUpdated, String jobRemoved) {
        this.jobUpdated = jobUpdated;
        this.jobRemoved = jobRemoved;
    }

    public static @NotNull JobChangeEvent updated(@NotNull Job job) {
        return new JobChangeEvent(Objects.requireNonNull(job), "");
    }

    public static @NotNull JobChangeEvent removed(@NotNull String jobId) {
        return new JobChangeEvent(null, Objects.requireNonNull(jobId));
    }

    public @Nullable Job getJobUpdated() {
        return jobUpdated;
    }

    public @NotNull String getJobRemoved() {
        return jobRemoved;
    }

    public boolean isRemoval() {
        return jobUpdated == null;
    }

    @Override
    public String toString() {
        return isRemoval() ? "JobChangeEvent{removed='" + jobRemoved + "'}" : "JobChangeEvent{updated=" + jobUpdated + '}';
    }
}
