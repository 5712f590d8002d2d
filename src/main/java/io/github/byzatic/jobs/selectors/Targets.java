package io.github.byzatic.jobs.selectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.User;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a selector resolution: the entities an action applies to and how it is invoked on them.
 * Single use, the underlying sequence may be a lazy catalog walk.
 */
public final class Targets {
    public enum Mode {PASS_THROUGH, NODES, USERS}

    private final Mode mode;
    private final Iterable<Node> nodes;
    private final Iterable<User> users;
    private final boolean collect;

    private Targets(Mode mode, Iterable<Node> nodes, Iterable<User> users, boolean collect) {
        this.mode = mode;
        this.nodes = nodes;
        this.users = users;
        this.collect = collect;
    }

    public static Targets passThrough() {
        return new Targets(Mode.PASS_THROUGH, List.of(), List.of(), true);
    }

    public static Targets ofNodes(@NotNull Iterable<Node> nodes, boolean collect) {
        return new Targets(Mode.NODES, Objects.requireNonNull(nodes), List.of(), collect);
    }

    public static Targets ofUsers(@NotNull Iterable<User> users, boolean collect) {
        return new Targets(Mode.USERS, List.of(), Objects.requireNonNull(users), collect);
    }

    public @NotNull Mode getMode() {
        return mode;
    }

    public boolean isCollect() {
        return collect;
    }

    /**
     * The messages to invoke the action with: the inbound message itself when nothing is selected,
     * one message per entity, or a single message carrying every entity when collecting.
     * An empty selection yields no invocation.
     */
    public @NotNull Iterator<ActionMessage> invocations(@NotNull ActionMessage inbound) {
        switch (mode) {
            case NODES:
                if (collect) {
                    List<Node> all = ImmutableList.copyOf(nodes);
                    return all.isEmpty() ? Iterators.forArray() : Iterators.singletonIterator(inbound.withNodes(all));
                }
                return Iterators.transform(nodes.iterator(), node -> inbound.withNodes(List.of(node)));
            case USERS:
                if (collect) {
                    List<User> all = ImmutableList.copyOf(users);
                    return all.isEmpty() ? Iterators.forArray() : Iterators.singletonIterator(inbound.withUsers(all));
                }
                return Iterators.transform(users.iterator(), user -> inbound.withUsers(List.of(user)));
            default:
                return Iterators.singletonIterator(inbound);
        }
    }

    @Override
    public String toString() {
        return "Targets{" + mode + (collect ? ", collect" : "") + '}';
    }
}
