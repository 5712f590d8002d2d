package io.github.byzatic.jobs.model;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Opaque filtering query. The engine never interprets sub-queries itself, it hands the
 * whole query to a {@link io.github.byzatic.jobs.selectors.QueryEvaluator}.
 */
public final class Query {
    public enum Operation {OR, AND}

    private final ImmutableList<String> subQueries;
    private final Operation operation;
    private final long offset;
    private final long limit;

    public Query(List<String> subQueries, Operation operation, long offset, long limit) {
        this.subQueries = ImmutableList.copyOf(Objects.requireNonNull(subQueries));
        this.operation = Objects.requireNonNull(operation);
        this.offset = offset;
        this.limit = limit;
    }

    public static @NotNull Query of(String... subQueries) {
        return new Query(List.of(subQueries), Operation.OR, 0, 0);
    }

    public static @NotNull Query allOf(String... subQueries) {
        return new Query(List.of(subQueries), Operation.AND, 0, 0);
    }

    public @NotNull List<String> getSubQueries() {
        return subQueries;
    }

    public @NotNull Operation getOperation() {
        return operation;
    }

    public long getOffset() {
        return offset;
    }

    /**
     * 0 means no limit.
     */
    public long getLimit() {
        return limit;
    }

    public boolean isEmpty() {
        return subQueries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Query query = (Query) o;
        return offset == query.offset && limit == query.limit && subQueries.equals(query.subQueries)
                && operation == query.operation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(subQueries, operation, offset, limit);
    }

    @Override
    public String toString() {
        return "Query{" + operation + subQueries + (limit > 0 ? ", offset=" + offset + ", limit=" + limit : "") + '}';
    }
}
