package io.github.byzatic.jobs.actions;

import io.github.byzatic.jobs.model.ActionLog;

/**
 * Notified from executor threads each time an action invocation is logged.
 */
@FunctionalInterface
public interface ActionLogListener {
    void onActionLogged(ChainRun run, ActionLog log);
}
