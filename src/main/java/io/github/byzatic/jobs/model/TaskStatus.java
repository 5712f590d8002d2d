package io.github.byzatic.jobs.model;

public enum TaskStatus {
    UNKNOWN,
    IDLE,
    RUNNING,
    FINISHED,
    INTERRUPTED,
    PAUSED,
    /**
     * Wildcard used by listings only, never carried by a task.
     */
    ANY,
    ERROR,
    QUEUED;

    public boolean isTerminal() {
        return this == FINISHED || this == ERROR || this == INTERRUPTED;
    }

    /**
     * Statuses holding a concurrency slot of their job.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean matches(TaskStatus filter) {
        return filter == null || filter == ANY || filter == UNKNOWN || filter == this;
    }

    public static String getStatusMessage(TaskStatus status) {
        return switch (status) {
            case IDLE -> "Idle";
            case QUEUED -> "Waiting for a free slot";
            case RUNNING -> "Running";
            case PAUSED -> "Paused";
            case FINISHED -> "Complete";
            case ERROR -> "Error";
            case INTERRUPTED -> "Interrupted";
            case UNKNOWN, ANY -> "";
        };
    }
}
