package io.github.byzatic.jobs;

import io.github.byzatic.jobs.actions.ActionChainExecutor;
import io.github.byzatic.jobs.actions.ActionHandler;
import io.github.byzatic.jobs.actions.ActionRegistry;
import io.github.byzatic.jobs.catalog.EntityCatalog;
import io.github.byzatic.jobs.config.JobsConfig;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.JobChangeEvent;
import io.github.byzatic.jobs.model.JobTriggerEvent;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.Task;
import io.github.byzatic.jobs.model.User;
import io.github.byzatic.jobs.schedulers.JobTimer;
import io.github.byzatic.jobs.selectors.QueryEvaluator;
import io.github.byzatic.jobs.selectors.SelectorResolver;
import io.github.byzatic.jobs.service.ChangeListener;
import io.github.byzatic.jobs.service.InMemoryJobStore;
import io.github.byzatic.jobs.service.JobService;
import io.github.byzatic.jobs.service.JobStore;
import io.github.byzatic.jobs.tasks.CommandAuthorizer;
import io.github.byzatic.jobs.tasks.StuckTaskDetector;
import io.github.byzatic.jobs.tasks.TaskRegistry;
import io.github.byzatic.jobs.tasks.TaskSupervisor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * JobsEngine
 * - Jobs fired by events, ISO-8601 repeating schedules, auto-start and run-once commands
 * - Per-job concurrency ceiling with FIFO queueing
 * - Action chains resolved on nodes or users and run on a configurable ThreadPoolExecutor
 * - Pause/resume/stop/delete of tasks through cooperative cancellation
 * - Periodic recovery of stuck tasks
 */
public final class JobsEngine implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(JobsEngine.class);

    private final JobsConfig config;
    private final ThreadPoolExecutor executor;
    private final ActionRegistry actions;
    private final TaskSupervisor supervisor;
    private final JobTimer timer;
    private final StuckTaskDetector detector;
    private final JobService service;

    private JobsEngine(Builder b) {
        this.config = b.config;
        this.executor = b.executor;
        this.actions = b.actions;
        ActionChainExecutor chainExecutor = new ActionChainExecutor(executor, b.resolver.build(), actions, config.getClock());
        this.supervisor = new TaskSupervisor(new TaskRegistry(), b.store, chainExecutor, config, b.authorizer, b.listeners);
        this.timer = new JobTimer(config.getClock(), supervisor::trigger);
        this.detector = new StuckTaskDetector(supervisor, config);
        this.service = new JobService(b.store, supervisor, timer, detector);

        supervisor.addListener(new ChangeListener() {
            @Override
            public void onJobChanged(JobChangeEvent event) {
                if (event.isRemoval()) timer.unregister(event.getJobRemoved());
            }
        });
        detector.start();
        logger.info("Jobs engine started: {}", config);
    }

    public static final class Builder {
        private JobsConfig config = JobsConfig.defaults();
        private ThreadPoolExecutor executor;
        private JobStore store = new InMemoryJobStore();
        private final ActionRegistry actions = new ActionRegistry();
        private final SelectorResolver.Builder resolver = SelectorResolver.newBuilder();
        private CommandAuthorizer authorizer = CommandAuthorizer.allowAll();
        private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();

        public Builder config(JobsConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        /**
         * Provide your own custom thread pool for action invocations.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder store(JobStore store) {
            this.store = Objects.requireNonNull(store);
            return this;
        }

        public Builder action(String actionId, ActionHandler handler) {
            actions.register(actionId, handler);
            return this;
        }

        public Builder nodeCatalog(EntityCatalog<Node> catalog) {
            resolver.nodeCatalog(catalog);
            return this;
        }

        public Builder userCatalog(EntityCatalog<User> catalog) {
            resolver.userCatalog(catalog);
            return this;
        }

        public Builder nodeEvaluator(QueryEvaluator<Node> evaluator) {
            resolver.nodeEvaluator(evaluator);
            return this;
        }

        public Builder userEvaluator(QueryEvaluator<User> evaluator) {
            resolver.userEvaluator(evaluator);
            return this;
        }

        public Builder messageEvaluator(QueryEvaluator<ActionMessage> evaluator) {
            resolver.messageEvaluator(evaluator);
            return this;
        }

        public Builder authorizer(CommandAuthorizer authorizer) {
            this.authorizer = Objects.requireNonNull(authorizer);
            return this;
        }

        public Builder addListener(ChangeListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public JobsEngine build() {
            resolver.pageSize(config.getCatalogPageSize());
            if (executor == null) {
                executor = new ThreadPoolExecutor(
                        config.getCorePoolSize(),
                        config.getMaxPoolSize(),
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        r -> {
                            Thread t = new Thread(r, "jobs-exec-" + UUID.randomUUID());
                            t.setDaemon(false);
                            t.setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex));
                            return t;
                        },
                        new ThreadPoolExecutor.AbortPolicy()
                );
                executor.allowCoreThreadTimeOut(true);
            }
            return new JobsEngine(this);
        }
    }

    // ======== Public API ========

    public @NotNull JobService service() {
        return service;
    }

    public @NotNull ActionRegistry actions() {
        return actions;
    }

    public @NotNull JobsConfig config() {
        return config;
    }

    public void addListener(@NotNull ChangeListener l) {
        supervisor.addListener(l);
    }

    public void removeListener(ChangeListener l) {
        supervisor.removeListener(l);
    }

    /**
     * Fires every active job listening to the event with the given message.
     */
    public @NotNull List<Task> publishEvent(@NotNull String eventName, @NotNull ActionMessage message) {
        return supervisor.publishEvent(eventName, message);
    }

    /**
     * Inbound trigger signal, as sent by an external timer.
     */
    public @NotNull Optional<Task> trigger(@NotNull JobTriggerEvent event) {
        return supervisor.trigger(event);
    }

    TaskSupervisor supervisor() {
        return supervisor;
    }

    @Override
    public void close() {
        timer.close();
        detector.close();
        supervisor.close();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getCloseGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        logger.info("Jobs engine closed");
    }
}
