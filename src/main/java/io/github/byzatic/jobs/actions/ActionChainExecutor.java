package io.github.byzatic.jobs.actions;

import com.google.common.base.Stopwatch;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.model.Action;
import io.github.byzatic.jobs.model.ActionLog;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.ActionOutput;
import io.github.byzatic.jobs.selectors.SelectorResolver;
import io.github.byzatic.jobs.selectors.Targets;
import io.github.byzatic.jobs.tasks.CancellationToken;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a chain of actions on the executor pool.
 * <p>
 * An action runs once per resolved target, one target after the other. Each successful invocation
 * dispatches all chained actions concurrently with its own copy of the message, carrying the
 * invocation output at the end of the output chain. A failed invocation of a non tolerant action
 * ends its branch only. Branches check the cancellation token before every invocation; a paused
 * branch holds no pool thread until it is resumed.
 */
@ThreadSafe
public final class ActionChainExecutor {
    private final static Logger logger = LoggerFactory.getLogger(ActionChainExecutor.class);

    private final Executor executor;
    private final SelectorResolver resolver;
    private final ActionRegistry registry;
    private final Clock clock;

    public ActionChainExecutor(@NotNull Executor executor, @NotNull SelectorResolver resolver, @NotNull ActionRegistry registry, @NotNull Clock clock) {
        this.executor = Objects.requireNonNull(executor);
        this.resolver = Objects.requireNonNull(resolver);
        this.registry = Objects.requireNonNull(registry);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Starts the chain. The returned future completes once every branch has ended, it never
     * completes exceptionally.
     *
     * @param runId    identifier used in logs, usually the task ID
     * @param roots    top-level actions, run concurrently
     * @param initial  message given to the top-level actions
     * @param token    stop and pause signal of the run
     * @param listener notified of every action log, may be called concurrently
     */
    public @NotNull CompletableFuture<ChainRun> run(@NotNull String runId, @NotNull List<Action> roots, @NotNull ActionMessage initial,
                                                    @NotNull CancellationToken token, @NotNull ActionLogListener listener) {
        ChainRun run = new ChainRun(runId, ActionTree.compile(roots), token);
        logger.debug("Run {} starts with {} action(s)", runId, run.getTree().size());
        List<CompletableFuture<Void>> branches = new ArrayList<>();
        for (int root : run.getTree().roots()) branches.add(dispatch(run, root, initial, listener));
        return CompletableFuture.allOf(branches.toArray(new CompletableFuture[0]))
                .handle((v, ex) -> {
                    if (ex != null) {
                        logger.error("Run {} ended abnormally", runId, ex);
                        run.fail("Unexpected error: " + ex);
                    }
                    logger.debug("Run {} ended: {}", runId, run);
                    return run;
                });
    }

    private CompletableFuture<Void> dispatch(ChainRun run, int node, ActionMessage message, ActionLogListener listener) {
        NodeRun step = new NodeRun(run, node, message, listener);
        submit(step);
        return step.done;
    }

    private void submit(NodeRun step) {
        try {
            executor.execute(() -> advance(step));
        } catch (RejectedExecutionException e) {
            logger.warn("Run {} can't dispatch action {}: executor rejected it", step.run.getRunId(), step.action.getId());
            step.run.fail("Executor rejected action " + step.action.getId());
            step.finish();
        }
    }

    /**
     * Runs the steps of one action on the current pool thread until it is over or the token is paused.
     * A paused branch gives its thread back and is submitted again on resume.
     */
    private void advance(NodeRun step) {
        try {
            while (true) {
                CompletableFuture<Boolean> runnable = step.run.getToken().whenRunnable();
                if (!runnable.isDone()) {
                    logger.debug("Run {}: action {} parked while paused", step.run.getRunId(), step.action.getId());
                    runnable.whenComplete((go, ex) -> {
                        if (Boolean.TRUE.equals(go)) {
                            submit(step);
                        } else {
                            step.finish();
                        }
                    });
                    return;
                }
                if (!runnable.join() || !step.next()) {
                    step.finish();
                    return;
                }
            }
        } catch (RuntimeException e) {
            logger.error("Run {}: action {} ended abnormally", step.run.getRunId(), step.action.getId(), e);
            step.run.fail("Unexpected error in action " + step.action.getId() + ": " + e);
            step.finish();
        }
    }

    /**
     * One action of the tree applied to its inbound message. Its steps run one at a time, each on a
     * pool thread: target resolution first, then one invocation per target.
     */
    private final class NodeRun {
        final ChainRun run;
        final int node;
        final ActionMessage inbound;
        final ActionLogListener listener;
        final Action action;
        final String branch;
        final List<CompletableFuture<Void>> children = new ArrayList<>();
        final CompletableFuture<Void> done = new CompletableFuture<>();
        ActionHandler handler;
        Iterator<ActionMessage> invocations;
        int count;

        NodeRun(ChainRun run, int node, ActionMessage inbound, ActionLogListener listener) {
            this.run = run;
            this.node = node;
            this.inbound = inbound;
            this.listener = listener;
            this.action = run.getTree().action(node);
            this.branch = run.getTree().branch(node);
        }

        /**
         * @return false once the action has nothing left to run
         */
        boolean next() {
            return invocations == null ? resolve() : invokeNext();
        }

        private boolean resolve() {
            handler = registry.lookup(action.getId()).orElse(null);
            if (handler == null) {
                configurationFailure(run, node, branch, inbound, "No handler registered for action " + action.getId(), listener);
                return false;
            }
            try {
                if (!resolver.accepts(action.getSourceFilter(), inbound)) {
                    ignore(run, node, branch, inbound, "Source filter did not match", listener);
                    return false;
                }
                Targets targets = resolver.resolve(action.getSelector(), action.getFilter(), inbound);
                invocations = targets.invocations(inbound);
            } catch (ConfigurationException e) {
                configurationFailure(run, node, branch, inbound, "Invalid selector for action " + action.getId() + ": " + e.getMessage(), listener);
                return false;
            } catch (RuntimeException e) {
                configurationFailure(run, node, branch, inbound, "Can't resolve targets of action " + action.getId() + ": " + e.getMessage(), listener);
                return false;
            }
            return true;
        }

        private boolean invokeNext() {
            CancellationToken token = run.getToken();
            ActionMessage input;
            try {
                if (!invocations.hasNext()) {
                    if (count == 0 && !token.isStopRequested()) ignore(run, node, branch, inbound, "No target matched", listener);
                    return false;
                }
                input = invocations.next();
            } catch (RuntimeException e) {
                logger.warn("Run {}: target resolution of action {} failed", run.getRunId(), action.getId(), e);
                run.fail("Can't resolve targets of action " + action.getId() + ": " + e.getMessage());
                return false;
            }
            if (count > 0) run.progress().extraInvocation(node);
            String invocationBranch = count == 0 ? branch : branch + "#" + count;
            count++;

            ActionOutput output = invoke(handler, action, input, token);
            if (token.isStopRequested()) {
                logger.info("Run {}: discarding result of action {} on branch {} received after stop: success={}",
                        run.getRunId(), action.getId(), invocationBranch, output.isSuccess());
                return false;
            }
            ActionMessage outbound = input.withOutput(output);
            record(run, new ActionLog(action, invocationBranch, input, outbound, clock.instant()), listener);

            if (output.isSuccess() || action.isTolerant()) {
                if (!output.isSuccess()) {
                    logger.debug("Run {}: tolerant action {} failed on branch {}: {}", run.getRunId(), action.getId(), invocationBranch, output.getErrorString());
                }
                for (int child : run.getTree().children(node)) children.add(dispatch(run, child, outbound, listener));
            } else {
                logger.debug("Run {}: action {} failed on branch {}: {}", run.getRunId(), action.getId(), invocationBranch, output.getErrorString());
                run.fail("Action " + action.getId() + " failed: " + output.getErrorString());
                run.progress().halted(node);
            }
            return true;
        }

        /**
         * Completes {@link #done} once every dispatched child branch is over.
         */
        void finish() {
            CompletableFuture.allOf(children.toArray(new CompletableFuture[0]))
                    .whenComplete((v, ex) -> done.complete(null));
        }
    }

    private ActionOutput invoke(ActionHandler handler, Action action, ActionMessage input, CancellationToken token) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        ActionOutput output;
        try {
            output = handler.run(action, input, token);
            if (output == null) output = ActionOutput.failure("Action " + action.getId() + " returned no output");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            output = ActionOutput.failure("Action " + action.getId() + " interrupted");
        } catch (Exception e) {
            logger.warn("Action {} threw", action.getId(), e);
            output = ActionOutput.failure(e.getMessage() == null ? e.getClass().getName() : e.getMessage());
        }
        if (output.getTime().isZero()) output = ActionOutput.newBuilder(output).setTime(stopwatch.elapsed()).build();
        return output;
    }

    private void ignore(ChainRun run, int node, String branch, ActionMessage inbound, String reason, ActionLogListener listener) {
        Action action = run.getTree().action(node);
        logger.debug("Run {}: action {} ignored: {}", run.getRunId(), action.getId(), reason);
        record(run, new ActionLog(action, branch, inbound, inbound.withOutput(ActionOutput.ignored(reason)), clock.instant()), listener);
        run.progress().halted(node);
    }

    private void configurationFailure(ChainRun run, int node, String branch, ActionMessage inbound, String error, ActionLogListener listener) {
        Action action = run.getTree().action(node);
        logger.warn("Run {}: {}", run.getRunId(), error);
        run.fail(error);
        record(run, new ActionLog(action, branch, inbound, inbound.withOutput(ActionOutput.failure(error)), clock.instant()), listener);
        run.progress().halted(node);
    }

    private void record(ChainRun run, ActionLog log, ActionLogListener listener) {
        run.log(log);
        run.progress().completed();
        try {
            listener.onActionLogged(run, log);
        } catch (Throwable t) {
            logger.error("Action log listener failed on run {}", run.getRunId(), t);
        }
    }
}
