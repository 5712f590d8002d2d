package io.github.byzatic.jobs.tasks;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.actions.ActionChainExecutor;
import io.github.byzatic.jobs.actions.ChainRun;
import io.github.byzatic.jobs.base_exceptions.InvalidStateException;
import io.github.byzatic.jobs.base_exceptions.NotFoundException;
import io.github.byzatic.jobs.base_exceptions.PermissionException;
import io.github.byzatic.jobs.config.JobsConfig;
import io.github.byzatic.jobs.model.ActionLog;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.Command;
import io.github.byzatic.jobs.model.CtrlCommand;
import io.github.byzatic.jobs.model.CtrlCommandResponse;
import io.github.byzatic.jobs.model.Job;
import io.github.byzatic.jobs.model.JobChangeEvent;
import io.github.byzatic.jobs.model.JobTriggerEvent;
import io.github.byzatic.jobs.model.Task;
import io.github.byzatic.jobs.model.TaskChangeEvent;
import io.github.byzatic.jobs.model.TaskStatus;
import io.github.byzatic.jobs.service.ChangeListener;
import io.github.byzatic.jobs.service.JobStore;
import io.github.byzatic.jobs.util.UuidProvider;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Owns the tasks of every job: admission against the job concurrency ceiling, execution of the action
 * chain, control commands and stuck-task recovery.
 * <p>
 * Every status change is written to the {@link JobStore} and published to the {@link ChangeListener}s,
 * unless the job asks for silent task updates. Commands never wait for running actions: a stop or a
 * pause is observed by the chain before its next action invocation.
 */
@ThreadSafe
public final class TaskSupervisor implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(TaskSupervisor.class);

    private final TaskRegistry registry;
    private final JobStore store;
    private final ActionChainExecutor executor;
    private final JobsConfig config;
    private final CommandAuthorizer authorizer;
    private final Clock clock;
    private final List<ChangeListener> listeners;
    private final AtomicBoolean closing = new AtomicBoolean(false);

    public TaskSupervisor(@NotNull TaskRegistry registry, @NotNull JobStore store, @NotNull ActionChainExecutor executor,
                          @NotNull JobsConfig config, @NotNull CommandAuthorizer authorizer, @NotNull List<ChangeListener> listeners) {
        this.registry = Objects.requireNonNull(registry);
        this.store = Objects.requireNonNull(store);
        this.executor = Objects.requireNonNull(executor);
        this.config = Objects.requireNonNull(config);
        this.authorizer = Objects.requireNonNull(authorizer);
        this.clock = config.getClock();
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    public void addListener(@NotNull ChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ChangeListener listener) {
        listeners.remove(listener);
    }

    public @NotNull TaskRegistry getRegistry() {
        return registry;
    }

    // ======== Firings ========

    /**
     * Creates a task for the job, running at once when a slot is free, queued otherwise.
     *
     * @return the new task, empty when the job is inactive and the source does not override it
     */
    public @NotNull Optional<Task> fire(@NotNull Job job, @NotNull ActionMessage message, String owner, @NotNull FiringSource source) {
        if (closing.get()) {
            logger.debug("Supervisor closing, {} firing of job {} ignored", source, job.getId());
            return Optional.empty();
        }
        if (job.isInactive() && !source.firesInactiveJobs()) {
            logger.debug("Job {} is inactive, {} firing ignored", job.getId(), source);
            return Optional.empty();
        }
        Instant now = clock.instant();
        TaskRecord rec = new TaskRecord(UuidProvider.generateUuidString(), job, message, owner,
                config.isTaskCanStop(), config.isTaskCanPause(), config.isTaskHasProgress(), now);
        registry.add(rec);
        boolean admitted = registry.slots(job.getId()).admit(rec, limitOf(job), now);
        logger.debug("Task {} of job {} fired by {}: {}", rec.taskId, job.getId(), source, rec.getStatus());
        Task snapshot = persist(rec);
        if (admitted) start(rec);
        return Optional.of(snapshot);
    }

    /**
     * Fires the job named by a timer or an external trigger. Triggers of unknown jobs, and timer
     * triggers carrying another schedule than the job's current one, are ignored.
     */
    public @NotNull Optional<Task> trigger(@NotNull JobTriggerEvent event) {
        Optional<Job> job = store.getJob(event.getJobId());
        if (job.isEmpty()) {
            logger.debug("Trigger for unknown job {} ignored", event.getJobId());
            return Optional.empty();
        }
        if (event.isRunNow()) {
            return fire(job.get(), ActionMessage.empty(), job.get().getOwner(), FiringSource.RUN_ONCE);
        }
        if (!Objects.equals(event.getSchedule(), job.get().getSchedule())) {
            logger.debug("Stale trigger for job {} ignored: {}", event.getJobId(), event.getSchedule());
            return Optional.empty();
        }
        return fire(job.get(), ActionMessage.empty(), job.get().getOwner(), FiringSource.TIMER);
    }

    /**
     * Fires every stored job listening to the event.
     */
    public @NotNull List<Task> publishEvent(@NotNull String eventName, @NotNull ActionMessage message) {
        List<Task> fired = new ArrayList<>();
        for (Job job : store.listJobs()) {
            if (job.getEventNames().contains(eventName)) {
                fire(job, message, job.getOwner(), FiringSource.EVENT).ifPresent(fired::add);
            }
        }
        return fired;
    }

    private void start(TaskRecord rec) {
        CompletableFuture<ChainRun> future;
        try {
            future = executor.run(rec.taskId, rec.job.getActions(), rec.message, rec.token, (run, log) -> onActionLogged(rec, run, log));
        } catch (RuntimeException e) {
            logger.error("Task {} of job {} can't start", rec.taskId, rec.getJobId(), e);
            complete(rec, TaskStatus.ERROR, "Can't start: " + e.getMessage());
            return;
        }
        rec.runningFuture = future;
        future.whenComplete((run, ex) -> onRunEnded(rec, run, ex));
    }

    private void onActionLogged(TaskRecord rec, ChainRun run, ActionLog log) {
        if (!rec.appendLog(log, run.getProgress(), clock.instant())) {
            logger.debug("Task {} is over, log of action {} dropped", rec.taskId, log.getAction().getId());
            return;
        }
        persist(rec);
    }

    private void onRunEnded(TaskRecord rec, ChainRun run, Throwable ex) {
        if (ex != null) {
            logger.error("Task {} of job {} failed", rec.taskId, rec.getJobId(), ex);
            complete(rec, TaskStatus.ERROR, String.valueOf(ex));
            return;
        }
        TaskStatus status = run.getStatus();
        String message;
        switch (status) {
            case ERROR:
                message = run.getError();
                break;
            case INTERRUPTED:
                message = rec.token.reason();
                break;
            default:
                rec.setProgress(1f);
                message = TaskStatus.getStatusMessage(status);
        }
        if (!complete(rec, status, message)) {
            logger.debug("Task {} ended as {} after it was already {}", rec.taskId, status, rec.getStatus());
        }
    }

    /**
     * Moves a task to a terminal status, gives back its slot and starts the next queued tasks.
     *
     * @return false when the task was already terminal
     */
    private boolean complete(TaskRecord rec, TaskStatus terminal, String message) {
        JobSlots slots = registry.slots(rec.getJobId());
        if (!slots.finish(rec, terminal, message, clock.instant())) return false;
        logger.info("Task {} of job {} is {}: {}", rec.taskId, rec.getJobId(), terminal, message);
        persist(rec);
        registry.remove(rec);
        if (closing.get()) return true;
        for (TaskRecord next : slots.promote(limitOf(currentJob(rec)), clock.instant())) {
            logger.debug("Task {} of job {} promoted", next.taskId, next.getJobId());
            persist(next);
            start(next);
        }
        if (terminal == TaskStatus.FINISHED && rec.job.isAutoClean()) autoClean(rec.getJobId());
        return true;
    }

    private void autoClean(String jobId) {
        if (!registry.ofJob(jobId).isEmpty()) return;
        if (store.deleteJob(jobId)) {
            logger.info("Job {} auto-cleaned", jobId);
            notifyListeners(l -> l.onJobChanged(JobChangeEvent.removed(jobId)));
        }
    }

    // ======== Control ========

    /**
     * Applies an operator command.
     *
     * @throws NotFoundException     unknown command, job or task
     * @throws PermissionException   the command owner may not control the job
     * @throws InvalidStateException the task status does not allow the command
     */
    public @NotNull CtrlCommandResponse control(@NotNull CtrlCommand command) throws NotFoundException, PermissionException, InvalidStateException {
        Command cmd = command.getCmd();
        if (cmd == Command.NONE) throw new NotFoundException("Unknown command " + cmd);
        Job job = store.getJob(command.getJobId())
                .orElseThrow(() -> new NotFoundException("Job not found: " + command.getJobId()));
        authorizer.authorize(command, job);

        switch (cmd) {
            case INACTIVE:
            case ACTIVE: {
                Job updated = job.withInactive(cmd == Command.INACTIVE);
                store.putJob(updated);
                notifyListeners(l -> l.onJobChanged(JobChangeEvent.updated(updated)));
                logger.info("Job {} set {} by {}", job.getId(), cmd, command.getOwnerId());
                return new CtrlCommandResponse("Job " + job.getId() + (updated.isInactive() ? " deactivated" : " activated"));
            }
            case RUN_ONCE: {
                Task task = fire(job, ActionMessage.empty(), command.getOwnerId(), FiringSource.RUN_ONCE)
                        .orElseThrow(() -> new InvalidStateException("Job " + job.getId() + " can't run"));
                return new CtrlCommandResponse("Task " + task.getId() + " is " + task.getStatus());
            }
            case STOP:
                if (!command.hasTaskId()) return stopJob(job, command);
                break;
            default:
                if (!command.hasTaskId()) throw new NotFoundException("Command " + cmd + " needs a task ID");
        }

        Optional<TaskRecord> live = registry.get(command.getTaskId()).filter(r -> r.getJobId().equals(job.getId()));
        if (live.isEmpty()) return controlStoredTask(command);
        TaskRecord rec = live.get();
        switch (cmd) {
            case PAUSE:
                return pause(rec);
            case RESUME:
                return resume(rec);
            case STOP:
                stop(rec, "Stopped by " + command.getOwnerId());
                return new CtrlCommandResponse("Task " + rec.taskId + " stopped");
            case DELETE:
                return delete(rec, command);
            default:
                throw new NotFoundException("Unknown command " + cmd);
        }
    }

    private CtrlCommandResponse controlStoredTask(CtrlCommand command) throws NotFoundException, InvalidStateException {
        Task task = store.getTask(command.getTaskId())
                .filter(t -> t.getJobId().equals(command.getJobId()))
                .orElseThrow(() -> new NotFoundException("Task not found: " + command.getTaskId()));
        if (command.getCmd() == Command.DELETE) {
            if (task.getStatus().isActive() && !config.isDeleteStopsRunning()) {
                throw new InvalidStateException("Task " + task.getId() + " is " + task.getStatus());
            }
            store.deleteTask(task.getId());
            logger.info("Task {} deleted by {}", task.getId(), command.getOwnerId());
            return new CtrlCommandResponse("Task " + task.getId() + " deleted");
        }
        throw new InvalidStateException("Can't " + command.getCmd() + " task " + task.getId() + ": it is " + task.getStatus());
    }

    private CtrlCommandResponse pause(TaskRecord rec) throws InvalidStateException {
        if (!rec.canPause) throw new InvalidStateException("Task " + rec.taskId + " can't be paused");
        synchronized (rec) {
            if (rec.getStatus() != TaskStatus.RUNNING || !rec.token.pause()) {
                throw new InvalidStateException("Can't pause task " + rec.taskId + ": it is " + rec.getStatus());
            }
            rec.transition(TaskStatus.PAUSED, null, clock.instant());
        }
        persist(rec);
        return new CtrlCommandResponse("Task " + rec.taskId + " paused");
    }

    private CtrlCommandResponse resume(TaskRecord rec) throws InvalidStateException {
        synchronized (rec) {
            if (rec.getStatus() != TaskStatus.PAUSED) {
                throw new InvalidStateException("Can't resume task " + rec.taskId + ": it is " + rec.getStatus());
            }
            rec.transition(TaskStatus.RUNNING, null, clock.instant());
        }
        // outside the record monitor: waking parked branches may end the run on this thread
        rec.token.resume();
        persist(rec);
        return new CtrlCommandResponse("Task " + rec.taskId + " resumed");
    }

    /**
     * Interrupts a queued, running or paused task. Its slot is free right away, the chain stops before
     * its next action invocation.
     */
    private void stop(TaskRecord rec, String reason) throws InvalidStateException {
        TaskStatus status = rec.getStatus();
        if (status.isTerminal()) throw new InvalidStateException("Can't stop task " + rec.taskId + ": it is " + status);
        if (status.isActive() && !rec.canStop) throw new InvalidStateException("Task " + rec.taskId + " can't be stopped");
        rec.token.requestStop(reason);
        if (!complete(rec, TaskStatus.INTERRUPTED, reason)) {
            logger.debug("Task {} ended as {} before the stop applied", rec.taskId, rec.getStatus());
        }
    }

    private CtrlCommandResponse stopJob(Job job, CtrlCommand command) {
        int stopped = 0;
        for (TaskRecord rec : registry.ofJob(job.getId())) {
            try {
                stop(rec, "Stopped by " + command.getOwnerId());
                stopped++;
            } catch (InvalidStateException e) {
                logger.debug("Task {} not stopped: {}", rec.taskId, e.getMessage());
            }
        }
        return new CtrlCommandResponse("Stopped " + stopped + " task(s) of job " + job.getId());
    }

    private CtrlCommandResponse delete(TaskRecord rec, CtrlCommand command) throws InvalidStateException {
        TaskStatus status = rec.getStatus();
        if (!status.isTerminal()) {
            if (status.isActive() && !config.isDeleteStopsRunning()) {
                throw new InvalidStateException("Can't delete task " + rec.taskId + ": it is " + status);
            }
            stop(rec, "Deleted by " + command.getOwnerId());
        }
        registry.remove(rec);
        store.deleteTask(rec.taskId);
        logger.info("Task {} deleted by {}", rec.taskId, command.getOwnerId());
        return new CtrlCommandResponse("Task " + rec.taskId + " deleted");
    }

    /**
     * Deletes a task whatever its status, stopping it first when live. Used by task pruning.
     *
     * @throws InvalidStateException the task is running and deleting running tasks is refused
     */
    public boolean deleteTask(@NotNull String taskId, @NotNull String reason) throws InvalidStateException {
        Optional<TaskRecord> live = registry.get(taskId);
        if (live.isPresent()) {
            TaskRecord rec = live.get();
            TaskStatus status = rec.getStatus();
            if (status.isActive() && !config.isDeleteStopsRunning()) {
                throw new InvalidStateException("Can't delete task " + taskId + ": it is " + status);
            }
            if (!status.isTerminal()) stop(rec, reason);
            registry.remove(rec);
        }
        return store.deleteTask(taskId);
    }

    /**
     * Interrupts every live task of the job, used when the job is deleted.
     */
    public int stopAll(@NotNull String jobId, @NotNull String reason) {
        int stopped = 0;
        for (TaskRecord rec : registry.ofJob(jobId)) {
            if (rec.getStatus().isTerminal()) continue;
            rec.token.requestStop(reason);
            complete(rec, TaskStatus.INTERRUPTED, reason);
            stopped++;
        }
        return stopped;
    }

    // ======== Stuck tasks ========

    /**
     * Interrupts running tasks with no update since {@code threshold}, live ones and those only known
     * by the store.
     *
     * @return IDs of the interrupted tasks
     */
    public @NotNull List<String> interruptStuck(@NotNull Duration threshold) {
        Instant now = clock.instant();
        Instant limit = now.minus(threshold);
        String message = "Timed out: no update for more than " + threshold.getSeconds() + "s";
        List<String> fixed = new ArrayList<>();
        for (TaskRecord rec : registry.all()) {
            Instant last = rec.getLastUpdate();
            if (rec.getStatus() != TaskStatus.RUNNING || last == null || !last.isBefore(limit)) continue;
            rec.token.requestStop(message);
            if (complete(rec, TaskStatus.INTERRUPTED, message)) {
                logger.warn("Task {} of job {} stuck since {}, interrupted", rec.taskId, rec.getJobId(), last);
                fixed.add(rec.taskId);
            }
        }
        for (Task task : store.listTasks(null)) {
            if (task.getStatus() != TaskStatus.RUNNING || registry.get(task.getId()).isPresent()) continue;
            Instant last = task.getLastUpdate() != null ? task.getLastUpdate() : task.getStartTime();
            if (last != null && !last.isBefore(limit)) continue;
            Task interrupted = Task.newBuilder(task)
                    .setStatus(TaskStatus.INTERRUPTED)
                    .setStatusMessage(message)
                    .setEndTime(now)
                    .setLastUpdate(now)
                    .build();
            store.putTask(interrupted);
            store.getJob(task.getJobId()).ifPresent(job -> notifyTask(interrupted, job));
            logger.warn("Stored task {} of job {} stuck, interrupted", task.getId(), task.getJobId());
            fixed.add(task.getId());
        }
        return fixed;
    }

    // ======== Internal ========

    private int limitOf(Job job) {
        return job.getMaxConcurrency() > 0 ? job.getMaxConcurrency() : config.getDefaultMaxConcurrency();
    }

    private Job currentJob(TaskRecord rec) {
        return store.getJob(rec.getJobId()).orElse(rec.job);
    }

    /**
     * Writes the current state of the task and notifies it. Writes of one record never overtake each
     * other and nothing is written once the terminal state is.
     */
    private Task persist(TaskRecord rec) {
        synchronized (rec.writeLock) {
            if (rec.terminalWritten) return rec.snapshot();
            Task snapshot = rec.snapshot();
            store.putTask(snapshot);
            if (snapshot.getStatus().isTerminal()) rec.terminalWritten = true;
            notifyTask(snapshot, currentJob(rec));
            return snapshot;
        }
    }

    /**
     * Publishes a job definition change to the listeners.
     */
    public void publishJobChange(@NotNull JobChangeEvent event) {
        notifyListeners(l -> l.onJobChanged(event));
    }

    /**
     * Publishes a task written from outside the supervisor.
     */
    public void publishTaskChange(@NotNull Task task, @NotNull Job job) {
        notifyTask(task, job);
    }

    private void notifyTask(Task task, Job job) {
        if (job.isTasksSilentUpdate()) return;
        TaskChangeEvent event = new TaskChangeEvent(task, job);
        notifyListeners(l -> l.onTaskChanged(event));
    }

    private void notifyListeners(Consumer<ChangeListener> c) {
        for (ChangeListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.error("Change listener failed", t);
            }
        }
    }

    /**
     * Stops every live task and waits up to the configured grace for their chains to end.
     */
    @Override
    public void close() {
        if (!closing.compareAndSet(false, true)) return;
        List<TaskRecord> live = registry.all();
        for (TaskRecord rec : live) {
            rec.token.requestStop("Supervisor closing");
            complete(rec, TaskStatus.INTERRUPTED, "Supervisor closing");
        }
        long deadline = System.nanoTime() + config.getCloseGrace().toNanos();
        for (TaskRecord rec : live) {
            CompletableFuture<?> f = rec.runningFuture;
            if (f == null) continue;
            long left = deadline - System.nanoTime();
            try {
                f.get(Math.max(1, left), TimeUnit.NANOSECONDS);
            } catch (TimeoutException te) {
                logger.warn("Task {} still running after close grace", rec.taskId);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                logger.debug("Task {} ended with {}", rec.taskId, e.toString());
            }
        }
    }
}
