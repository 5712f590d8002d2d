package io.github.byzatic.jobs.actions;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * Completed over planned action invocations of one run.
 * <p>
 * The plan starts with one invocation per tree node. Every extra entity an action runs on adds its
 * whole subtree, every invocation that does not reach its children removes them.
 */
@ThreadSafe
final class ProgressTracker {
    private final ActionTree tree;
    @GuardedBy("this")
    private long planned;
    @GuardedBy("this")
    private long completed;

    ProgressTracker(ActionTree tree) {
        this.tree = tree;
        this.planned = tree.size();
    }

    synchronized void extraInvocation(int node) {
        planned += tree.subtreeSize(node);
    }

    synchronized void completed() {
        completed++;
    }

    /**
     * The children of this invocation will not run.
     */
    synchronized void halted(int node) {
        planned -= tree.subtreeSize(node) - 1;
    }

    synchronized float ratio() {
        if (planned <= 0) return 1f;
        return Math.min(1f, (float) completed / planned);
    }

    synchronized long planned() {
        return planned;
    }

    synchronized long completedCount() {
        return completed;
    }
}
