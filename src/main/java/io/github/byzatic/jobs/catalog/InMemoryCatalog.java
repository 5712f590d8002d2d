package io.github.byzatic.jobs.catalog;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.User;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Catalog kept in insertion order.
 */
@ThreadSafe
public final class InMemoryCatalog<T> implements EntityCatalog<T> {
    private final Function<T, String> keyFunction;

    @GuardedBy("this")
    private final Map<String, T> entries = new LinkedHashMap<>();

    public InMemoryCatalog(@NotNull Function<T, String> keyFunction) {
        this.keyFunction = Objects.requireNonNull(keyFunction);
    }

    public static InMemoryCatalog<Node> ofNodes() {
        return new InMemoryCatalog<>(Node::getPath);
    }

    public static InMemoryCatalog<User> ofUsers() {
        return new InMemoryCatalog<>(User::getLogin);
    }

    @SafeVarargs
    public final synchronized InMemoryCatalog<T> add(T... entities) {
        for (T entity : entities) entries.put(keyFunction.apply(entity), entity);
        return this;
    }

    public synchronized boolean remove(String key) {
        return entries.remove(key) != null;
    }

    public synchronized int size() {
        return entries.size();
    }

    @Override
    public synchronized @NotNull List<T> page(int offset, int limit) {
        List<T> all = new ArrayList<>(entries.values());
        if (offset >= all.size()) return List.of();
        return List.copyOf(all.subList(offset, Math.min(all.size(), offset + limit)));
    }

    @Override
    public synchronized @NotNull Optional<T> lookup(@NotNull String key) {
        return Optional.ofNullable(entries.get(key));
    }
}
