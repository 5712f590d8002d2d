package io.github.byzatic.jobs.catalog;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read access to every node or user an action may select.
 * <p>
 * Pages must come in a stable order: reading the catalog twice without changes in between yields
 * the same sequence.
 *
 * @param <T> {@link io.github.byzatic.jobs.model.Node} or {@link io.github.byzatic.jobs.model.User}
 */
public interface EntityCatalog<T> {

    /**
     * @return at most {@code limit} entities starting at {@code offset}; an empty list past the end
     */
    @NotNull List<T> page(int offset, int limit) throws IOException;

    /**
     * Find one entity by its path (nodes) or login (users).
     */
    @NotNull Optional<T> lookup(@NotNull String key) throws IOException;
}
