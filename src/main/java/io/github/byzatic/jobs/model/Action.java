package io.github.byzatic.jobs.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.byzatic.jobs.selectors.NodesSelector;
import io.github.byzatic.jobs.selectors.Selector;
import io.github.byzatic.jobs.selectors.SourceFilter;
import io.github.byzatic.jobs.selectors.UsersSelector;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work of a job. The output of an action is the input of each of its chained actions,
 * which run in parallel when there are several.
 * <p>
 * An action resolves either nodes or users, never both: the selector and the filter are each a
 * single {@link Selector} variant.
 */
public final class Action {
    private final String id;
    private final Selector selector;
    private final Selector filter;
    private final SourceFilter sourceFilter;
    private final ImmutableMap<String, String> parameters;
    private final ImmutableList<Action> chainedActions;
    private final boolean tolerant;

    private Action(Builder builder) {
        this.id = builder.id;
        this.selector = builder.selector;
        this.filter = builder.filter;
        this.sourceFilter = builder.sourceFilter;
        this.parameters = ImmutableMap.copyOf(builder.parameters);
        this.chainedActions = ImmutableList.copyOf(builder.chainedActions);
        this.tolerant = builder.tolerant;
    }

    public static Builder newBuilder(@NotNull String id) {
        return new Builder(id);
    }

    public static Builder newBuilder(Action copy) {
        Builder builder = new Builder(copy.id);
        builder.selector = copy.selector;
        builder.filter = copy.filter;
        builder.sourceFilter = copy.sourceFilter;
        builder.parameters.putAll(copy.parameters);
        builder.chainedActions.addAll(copy.chainedActions);
        builder.tolerant = copy.tolerant;
        return builder;
    }

    public @NotNull String getId() {
        return id;
    }

    public @Nullable Selector getSelector() {
        return selector;
    }

    public @Nullable Selector getFilter() {
        return filter;
    }

    public @Nullable SourceFilter getSourceFilter() {
        return sourceFilter;
    }

    public @NotNull Map<String, String> getParameters() {
        return parameters;
    }

    public @Nullable String getParameter(String name) {
        return parameters.get(name);
    }

    public @NotNull List<Action> getChainedActions() {
        return chainedActions;
    }

    /**
     * A failed invocation of a tolerant action does not halt its branch.
     */
    public boolean isTolerant() {
        return tolerant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Action action = (Action) o;
        return tolerant == action.tolerant && id.equals(action.id) && Objects.equals(selector, action.selector)
                && Objects.equals(filter, action.filter) && Objects.equals(sourceFilter, action.sourceFilter)
                && parameters.equals(action.parameters) && chainedActions.equals(action.chainedActions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, selector, filter, sourceFilter, parameters, chainedActions, tolerant);
    }

    @Override
    public String toString() {
        return "Action{" +
                "id='" + id + '\'' +
                (selector != null ? ", selector=" + selector : "") +
                (filter != null ? ", filter=" + filter : "") +
                (sourceFilter != null ? ", sourceFilter=" + sourceFilter : "") +
                ", parameters=" + parameters +
                ", chained=" + chainedActions.size() +
                '}';
    }

    public static final class Builder {
        private final String id;
        private Selector selector;
        private Selector filter;
        private SourceFilter sourceFilter;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private final List<Action> chainedActions = new ArrayList<>();
        private boolean tolerant;

        private Builder(String id) {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("Action id must not be blank");
            this.id = id;
        }

        public Builder nodesSelector(NodesSelector selector) {
            this.selector = single(this.selector, selector, "selector");
            return this;
        }

        public Builder usersSelector(UsersSelector selector) {
            this.selector = single(this.selector, selector, "selector");
            return this;
        }

        public Builder nodesFilter(NodesSelector filter) {
            this.filter = single(this.filter, filter, "filter");
            return this;
        }

        public Builder usersFilter(UsersSelector filter) {
            this.filter = single(this.filter, filter, "filter");
            return this;
        }

        public Builder sourceFilter(SourceFilter sourceFilter) {
            this.sourceFilter = sourceFilter;
            return this;
        }

        public Builder parameter(String name, String value) {
            this.parameters.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder chain(Action... actions) {
            this.chainedActions.addAll(Arrays.asList(actions));
            return this;
        }

        public Builder tolerant(boolean tolerant) {
            this.tolerant = tolerant;
            return this;
        }

        public Action build() {
            return new Action(this);
        }

        private static Selector single(Selector current, Selector next, String what) {
            if (current != null && next != null && current.kind() != next.kind()) {
                throw new IllegalArgumentException("Action " + what + " targets either nodes or users, not both");
            }
            return next;
        }
    }
}
