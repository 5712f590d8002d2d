package io.github.byzatic.jobs.selectors;

import io.github.byzatic.jobs.model.Query;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One of the selector variants an action can carry. Resolution dispatches on {@link #kind()}.
 */
public abstract class Selector {
    public enum Kind {NODES, USERS, SOURCE}

    private final Query query;

    Selector(@Nullable Query query) {
        this.query = query;
    }

    public abstract @NotNull Kind kind();

    public @Nullable Query getQuery() {
        return query;
    }

    public boolean hasQuery() {
        return query != null && !query.isEmpty();
    }

    /**
     * Select every entity of the catalog. Always false for a source filter.
     */
    public boolean isAll() {
        return false;
    }

    /**
     * One invocation with the whole selection instead of one per entity.
     */
    public boolean isCollect() {
        return false;
    }
}
