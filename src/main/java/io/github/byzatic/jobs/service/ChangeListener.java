package io.github.byzatic.jobs.service;

import io.github.byzatic.jobs.model.JobChangeEvent;
import io.github.byzatic.jobs.model.TaskChangeEvent;

/**
 * Change notification sink.
 */
public interface ChangeListener {
    default void onJobChanged(JobChangeEvent event) {
    }

    default void onTaskChanged(TaskChangeEvent event) {
    }
}
