package io.github.byzatic.jobs.tasks;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobs.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Concurrency slots of one job: the count of running or paused tasks and the FIFO queue of tasks
 * waiting for a slot. The counter only changes together with the status of the task taking or
 * giving back the slot.
 */
@ThreadSafe
final class JobSlots {
    private final String jobId;
    @GuardedBy("this")
    private int running;
    @GuardedBy("this")
    private final Deque<TaskRecord> queue = new ArrayDeque<>();

    JobSlots(String jobId) {
        this.jobId = jobId;
    }

    /**
     * Starts the task when a slot is free, queues it otherwise.
     *
     * @param limit ceiling, unbounded when 0 or less
     * @return true when the task is now running
     */
    synchronized boolean admit(TaskRecord rec, int limit, Instant now) {
        if (limit <= 0 || running < limit) {
            running++;
            rec.acquireSlot(now);
            return true;
        }
        queue.addLast(rec);
        rec.transition(TaskStatus.QUEUED, null, now);
        return false;
    }

    /**
     * Moves a live task to a terminal status, giving back its slot or leaving the queue.
     *
     * @return false when the task was already terminal
     */
    synchronized boolean finish(TaskRecord rec, TaskStatus terminal, String message, Instant now) {
        synchronized (rec) {
            if (rec.getStatus().isTerminal()) return false;
            if (rec.releaseSlot()) running--;
            else queue.remove(rec);
            rec.transition(terminal, message, now);
            return true;
        }
    }

    /**
     * Starts queued tasks, oldest first, while slots are free.
     */
    synchronized List<TaskRecord> promote(int limit, Instant now) {
        ImmutableList.Builder<TaskRecord> promoted = ImmutableList.builder();
        while (!queue.isEmpty() && (limit <= 0 || running < limit)) {
            TaskRecord next = queue.pollFirst();
            running++;
            next.acquireSlot(now);
            promoted.add(next);
        }
        return promoted.build();
    }

    synchronized int running() {
        return running;
    }

    synchronized int queued() {
        return queue.size();
    }

    @Override
    public synchronized String toString() {
        return "JobSlots{jobId='" + jobId + "', running=" + running + ", queued=" + queue.size() + '}';
    }
}
