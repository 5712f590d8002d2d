package io.github.byzatic.jobs.selectors;

import com.google.common.collect.ImmutableList;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.Query;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class NodesSelector extends Selector {
    private final boolean all;
    private final ImmutableList<String> paths;
    private final ImmutableList<Node> nodes;
    private final boolean collect;

    private NodesSelector(Builder builder) {
        super(builder.query);
        this.all = builder.all;
        this.paths = ImmutableList.copyOf(builder.paths);
        this.nodes = ImmutableList.copyOf(builder.nodes);
        this.collect = builder.collect;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.NODES;
    }

    @Override
    public boolean isAll() {
        return all;
    }

    @Override
    public boolean isCollect() {
        return collect;
    }

    public @NotNull List<String> getPaths() {
        return paths;
    }

    public @NotNull List<Node> getNodes() {
        return nodes;
    }

    public boolean hasPreset() {
        return !paths.isEmpty() || !nodes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodesSelector that = (NodesSelector) o;
        return all == that.all && collect == that.collect && paths.equals(that.paths) && nodes.equals(that.nodes)
                && Objects.equals(getQuery(), that.getQuery());
    }

    @Override
    public int hashCode() {
        return Objects.hash(all, paths, nodes, getQuery(), collect);
    }

    @Override
    public String toString() {
        return "NodesSelector{all=" + all + ", paths=" + paths + ", nodes=" + nodes.size()
                + ", query=" + getQuery() + ", collect=" + collect + '}';
    }

    public static final class Builder {
        private boolean all;
        private final List<String> paths = new ArrayList<>();
        private final List<Node> nodes = new ArrayList<>();
        private Query query;
        private boolean collect;

        private Builder() {
        }

        public Builder all(boolean all) {
            this.all = all;
            return this;
        }

        public Builder paths(String... paths) {
            this.paths.addAll(Arrays.asList(paths));
            return this;
        }

        public Builder nodes(List<Node> nodes) {
            this.nodes.addAll(nodes);
            return this;
        }

        public Builder query(Query query) {
            this.query = query;
            return this;
        }

        public Builder collect(boolean collect) {
            this.collect = collect;
            return this;
        }

        public NodesSelector build() {
            return new NodesSelector(this);
        }
    }
}
