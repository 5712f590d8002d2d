package io.github.byzatic.jobs.selectors;

import io.github.byzatic.jobs.model.Query;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Filters the inbound message as a whole (its event, its previous outputs...).
 */
public final class SourceFilter extends Selector {

    public SourceFilter(@NotNull Query query) {
        super(Objects.requireNonNull(query));
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.SOURCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(getQuery(), ((SourceFilter) o).getQuery());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getQuery());
    }

    @Override
    public String toString() {
        return "SourceFilter{" + getQuery() + '}';
    }
}
