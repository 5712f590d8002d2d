package io.github.byzatic.jobs.model;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Persisted definition of what to run, when, and how many times in parallel.
 * <p>
 * A job is triggered by any of its event names, by its schedule, or once on insertion when
 * {@link #isAutoStart()} is set. These triggers are not exclusive.
 */
public final class Job {
    private final String id;
    private final String label;
    private final String owner;
    private final boolean inactive;
    private final ImmutableList<String> languages;
    private final ImmutableList<String> eventNames;
    private final Schedule schedule;
    private final boolean autoStart;
    private final boolean autoClean;
    private final ImmutableList<Action> actions;
    private final int maxConcurrency;
    private final boolean tasksSilentUpdate;
    private final ImmutableList<Task> tasks;

    private Job(Builder builder) {
        this.id = builder.id;
        this.label = builder.label;
        this.owner = builder.owner;
        this.inactive = builder.inactive;
        this.languages = ImmutableList.copyOf(builder.languages);
        this.eventNames = ImmutableList.copyOf(builder.eventNames);
        this.schedule = builder.schedule;
        this.autoStart = builder.autoStart;
        this.autoClean = builder.autoClean;
        this.actions = ImmutableList.copyOf(builder.actions);
        this.maxConcurrency = builder.maxConcurrency;
        this.tasksSilentUpdate = builder.tasksSilentUpdate;
        this.tasks = ImmutableList.copyOf(builder.tasks);
    }

    public static Builder newBuilder(@NotNull String id) {
        return new Builder(id);
    }

    public static Builder newBuilder(Job copy) {
        Builder builder = new Builder(copy.id);
        builder.label = copy.label;
        builder.owner = copy.owner;
        builder.inactive = copy.inactive;
        builder.languages.addAll(copy.languages);
        builder.eventNames.addAll(copy.eventNames);
        builder.schedule = copy.schedule;
        builder.autoStart = copy.autoStart;
        builder.autoClean = copy.autoClean;
        builder.actions.addAll(copy.actions);
        builder.maxConcurrency = copy.maxConcurrency;
        builder.tasksSilentUpdate = copy.tasksSilentUpdate;
        builder.tasks.addAll(copy.tasks);
        return builder;
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getLabel() {
        return label;
    }

    public @NotNull String getOwner() {
        return owner;
    }

    public boolean isInactive() {
        return inactive;
    }

    public @NotNull List<String> getLanguages() {
        return languages;
    }

    public @NotNull List<String> getEventNames() {
        return eventNames;
    }

    public @Nullable Schedule getSchedule() {
        return schedule;
    }

    public boolean hasSchedule() {
        return schedule != null && !schedule.getIso8601Schedule().isBlank();
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public boolean isAutoClean() {
        return autoClean;
    }

    public @NotNull List<Action> getActions() {
        return actions;
    }

    /**
     * 0 or less falls back to the engine default.
     */
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public boolean isTasksSilentUpdate() {
        return tasksSilentUpdate;
    }

    /**
     * Only filled when a job is read with its tasks.
     */
    public @NotNull List<Task> getTasks() {
        return tasks;
    }

    public @NotNull Job withTasks(@NotNull List<Task> tasks) {
        Builder builder = newBuilder(this);
        builder.tasks.clear();
        builder.tasks.addAll(tasks);
        return builder.build();
    }

    public @NotNull Job withInactive(boolean inactive) {
        return newBuilder(this).setInactive(inactive).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return inactive == job.inactive && autoStart == job.autoStart && autoClean == job.autoClean
                && maxConcurrency == job.maxConcurrency && tasksSilentUpdate == job.tasksSilentUpdate
                && id.equals(job.id) && label.equals(job.label) && owner.equals(job.owner)
                && languages.equals(job.languages) && eventNames.equals(job.eventNames)
                && Objects.equals(schedule, job.schedule) && actions.equals(job.actions) && tasks.equals(job.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, owner, inactive, languages, eventNames, schedule, autoStart, autoClean, actions,
                maxConcurrency, tasksSilentUpdate, tasks);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", label='" + label + '\'' +
                ", owner='" + owner + '\'' +
                (inactive ? ", inactive" : "") +
                (eventNames.isEmpty() ? "" : ", eventNames=" + eventNames) +
                (schedule != null ? ", schedule=" + schedule : "") +
                (autoStart ? ", autoStart" : "") +
                ", actions=" + actions.size() +
                ", maxConcurrency=" + maxConcurrency +
                '}';
    }

    public static final class Builder {
        private final String id;
        private String label = "";
        private String owner = "";
        private boolean inactive;
        private final List<String> languages = new ArrayList<>();
        private final List<String> eventNames = new ArrayList<>();
        private Schedule schedule;
        private boolean autoStart;
        private boolean autoClean;
        private final List<Action> actions = new ArrayList<>();
        private int maxConcurrency;
        private boolean tasksSilentUpdate;
        private final List<Task> tasks = new ArrayList<>();

        private Builder(String id) {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("Job id must not be blank");
            this.id = id;
        }

        public Builder setLabel(String label) {
            this.label = label == null ? "" : label;
            return this;
        }

        public Builder setOwner(String owner) {
            this.owner = owner == null ? "" : owner;
            return this;
        }

        public Builder setInactive(boolean inactive) {
            this.inactive = inactive;
            return this;
        }

        public Builder addLanguages(String... languages) {
            this.languages.addAll(Arrays.asList(languages));
            return this;
        }

        public Builder addEventNames(String... eventNames) {
            this.eventNames.addAll(Arrays.asList(eventNames));
            return this;
        }

        public Builder setSchedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        public Builder setAutoClean(boolean autoClean) {
            this.autoClean = autoClean;
            return this;
        }

        public Builder addActions(Action... actions) {
            this.actions.addAll(Arrays.asList(actions));
            return this;
        }

        public Builder setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder setTasksSilentUpdate(boolean tasksSilentUpdate) {
            this.tasksSilentUpdate = tasksSilentUpdate;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
