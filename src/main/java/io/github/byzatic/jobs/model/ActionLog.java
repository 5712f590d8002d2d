package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

/**
 * Trace of one action invocation. Entries of parallel branches interleave in a task log;
 * {@link #getBranch()} tells them apart.
 */
public final class ActionLog {
    private final Action action;
    private final String branch;
    private final ActionMessage inputMessage;
    private final ActionMessage outputMessage;
    private final Instant timestamp;

    public ActionLog(@NotNull Action action, @NotNull String branch, @NotNull ActionMessage inputMessage,
                     @NotNull ActionMessage outputMessage, @NotNull Instant timestamp) {
        this.action = Objects.requireNonNull(action);
        this.branch = Objects.requireNonNull(branch);
        this.inputMessage = Objects.requireNonNull(inputMessage);
        this.outputMessage = Objects.requireNonNull(outputMessage);
        this.timestamp = Objects.requireNonNull(timestamp);
    }

    public @NotNull Action getAction() {
        return action;
    }

    /**
     * Position of the action in the chain tree, e.g. {@code 0.1} for the second child of the first root.
     */
    public @NotNull String getBranch() {
        return branch;
    }

    public @NotNull ActionMessage getInputMessage() {
        return inputMessage;
    }

    public @NotNull ActionMessage getOutputMessage() {
        return outputMessage;
    }

    public @NotNull Instant getTimestamp() {
        return timestamp;
    }

    public @NotNull ActionOutput getOutput() {
        return outputMessage.getLastOutput().orElseThrow();
    }

    @Override
    public String toString() {
        return "ActionLog{action='" + action.getId() + "', branch='" + branch + "', output=" + outputMessage.getLastOutput().orElse(null) + '}';
    }
}
