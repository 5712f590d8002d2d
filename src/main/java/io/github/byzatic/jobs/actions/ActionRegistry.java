package io.github.byzatic.jobs.actions;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handlers keyed by action ID.
 */
@ThreadSafe
public final class ActionRegistry {
    private final static Logger logger = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    public ActionRegistry register(@NotNull String actionId, @NotNull ActionHandler handler) {
        ActionHandler previous = handlers.put(Objects.requireNonNull(actionId), Objects.requireNonNull(handler));
        if (previous != null) logger.debug("Handler of action {} replaced", actionId);
        return this;
    }

    public boolean unregister(@NotNull String actionId) {
        return handlers.remove(actionId) != null;
    }

    public @NotNull Optional<ActionHandler> lookup(@NotNull String actionId) {
        return Optional.ofNullable(handlers.get(actionId));
    }

    public @NotNull Set<String> actionIds() {
        return Set.copyOf(handlers.keySet());
    }
}
