package io.github.byzatic.jobs.tasks;

/**
 * What created a task.
 */
public enum FiringSource {
    EVENT,
    TIMER,
    AUTO_START,
    RUN_ONCE;

    /**
     * Inactive jobs only run on explicit requests.
     */
    public boolean firesInactiveJobs() {
        return this == RUN_ONCE;
    }
}
