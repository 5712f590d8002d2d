package io.github.byzatic.jobs.actions;

import com.google.common.collect.ImmutableList;
import io.github.byzatic.jobs.model.ActionLog;
import io.github.byzatic.jobs.model.TaskStatus;
import io.github.byzatic.jobs.tasks.CancellationToken;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one execution of an action chain, shared by all its branches.
 */
public final class ChainRun {
    private final String runId;
    private final ActionTree tree;
    private final CancellationToken token;
    private final ProgressTracker progress;
    private final Queue<ActionLog> logs = new ConcurrentLinkedQueue<>();
    private final AtomicReference<String> error = new AtomicReference<>();

    ChainRun(String runId, ActionTree tree, CancellationToken token) {
        this.runId = runId;
        this.tree = tree;
        this.token = token;
        this.progress = new ProgressTracker(tree);
    }

    public @NotNull String getRunId() {
        return runId;
    }

    public @NotNull ActionTree getTree() {
        return tree;
    }

    public @NotNull CancellationToken getToken() {
        return token;
    }

    ProgressTracker progress() {
        return progress;
    }

    void log(ActionLog log) {
        logs.add(log);
    }

    /**
     * Records an unhandled failure. The first one is kept as the run error.
     */
    void fail(String message) {
        error.compareAndSet(null, message);
    }

    public boolean isFailed() {
        return error.get() != null;
    }

    public @NotNull String getError() {
        String e = error.get();
        return e == null ? "" : e;
    }

    /**
     * Logs in completion order. Logs of one branch are in execution order.
     */
    public @NotNull List<ActionLog> getLogs() {
        return ImmutableList.copyOf(logs);
    }

    public float getProgress() {
        return progress.ratio();
    }

    public @NotNull TaskStatus getStatus() {
        if (isFailed()) return TaskStatus.ERROR;
        if (token.isStopRequested()) return TaskStatus.INTERRUPTED;
        return TaskStatus.FINISHED;
    }

    @Override
    public String toString() {
        return "ChainRun{" +
                "runId='" + runId + '\'' +
                ", status=" + getStatus() +
                ", logs=" + logs.size() +
                ", progress=" + progress.ratio() +
                '}';
    }
}
