package io.github.byzatic.jobs.actions;

import io.github.byzatic.jobs.model.Action;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.ActionOutput;
import io.github.byzatic.jobs.tasks.CancellationToken;

/**
 * Operation behind an action ID.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Runs the action once on the given message. Long operations should look at the token and
     * return early when a stop is requested.
     *
     * @param action  the action being run, with its parameters
     * @param message input message, carrying the resolved nodes or users
     * @param token   stop signal of the task
     * @return the result, a failed output for a handled error
     * @throws Exception on any unhandled error, recorded as a failed output
     */
    ActionOutput run(Action action, ActionMessage message, CancellationToken token) throws Exception;
}
