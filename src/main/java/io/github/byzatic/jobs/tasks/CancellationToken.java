package io.github.byzatic.jobs.tasks;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Cooperative stop and pause signal of one task run. Branches check it between action invocations,
 * an invocation already running is never interrupted.
 * <p>
 * The chain executor parks paused branches on {@link #whenRunnable()} so that no pool thread waits for
 * a resume. {@link #checkpoint()} blocks and is meant for handlers that poll the token themselves.
 */
@ThreadSafe
public final class CancellationToken {
    @GuardedBy("this")
    private boolean stop;
    @GuardedBy("this")
    private boolean paused;
    @GuardedBy("this")
    private String reason = "";
    @GuardedBy("this")
    private CompletableFuture<Boolean> resumed;

    public synchronized boolean isStopRequested() {
        return stop;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    public synchronized String reason() {
        return reason;
    }

    /**
     * Requests a stop and wakes up paused branches. Only the first reason is kept.
     */
    public void requestStop(String reason) {
        CompletableFuture<Boolean> parked;
        synchronized (this) {
            if (!stop) this.reason = reason == null ? "" : reason;
            stop = true;
            notifyAll();
            parked = resumed;
            resumed = null;
        }
        if (parked != null) parked.complete(false);
    }

    synchronized boolean pause() {
        if (stop || paused) return false;
        paused = true;
        resumed = new CompletableFuture<>();
        return true;
    }

    boolean resume() {
        CompletableFuture<Boolean> parked;
        synchronized (this) {
            if (!paused) return false;
            paused = false;
            notifyAll();
            parked = resumed;
            resumed = null;
        }
        if (parked != null) parked.complete(!isStopRequested());
        return true;
    }

    /**
     * Non blocking checkpoint. The future is already complete unless the token is paused, then it
     * completes on resume or stop.
     *
     * @return a future holding false when a stop was requested and the branch must not continue
     */
    public synchronized @NotNull CompletableFuture<Boolean> whenRunnable() {
        if (stop) return CompletableFuture.completedFuture(false);
        if (paused) return resumed.copy();
        return CompletableFuture.completedFuture(true);
    }

    /**
     * Blocks while paused.
     *
     * @return false when a stop was requested and the branch must not continue
     */
    public synchronized boolean checkpoint() throws InterruptedException {
        while (paused && !stop) wait();
        return !stop;
    }

    /**
     * Throws InterruptedException if a stop was requested.
     */
    public void throwIfStopRequested() throws InterruptedException {
        if (isStopRequested()) throw new InterruptedException("Stop requested: " + reason());
    }
}
