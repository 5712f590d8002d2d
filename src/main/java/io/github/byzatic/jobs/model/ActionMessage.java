package io.github.byzatic.jobs.model;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Value passed from one action to the next. Immutable: every {@code with*} method returns a new
 * message, so parallel branches never see each other's outputs. The output chain only grows.
 */
public final class ActionMessage {
    private static final ActionMessage EMPTY = new ActionMessage(null, ImmutableList.of(), ImmutableList.of(),
            ImmutableList.of(), ImmutableList.of());

    private final Object event;
    private final ImmutableList<Node> nodes;
    private final ImmutableList<User> users;
    private final ImmutableList<ActivityObject> activities;
    private final ImmutableList<ActionOutput> outputChain;

    private ActionMessage(Object event, ImmutableList<Node> nodes, ImmutableList<User> users,
                          ImmutableList<ActivityObject> activities, ImmutableList<ActionOutput> outputChain) {
        this.event = event;
        this.nodes = nodes;
        this.users = users;
        this.activities = activities;
        this.outputChain = outputChain;
    }

    public static @NotNull ActionMessage empty() {
        return EMPTY;
    }

    public static @NotNull ActionMessage ofEvent(@Nullable Object event) {
        return EMPTY.withEvent(event);
    }

    public @Nullable Object getEvent() {
        return event;
    }

    public @NotNull List<Node> getNodes() {
        return nodes;
    }

    public @NotNull List<User> getUsers() {
        return users;
    }

    public @NotNull List<ActivityObject> getActivities() {
        return activities;
    }

    public @NotNull List<ActionOutput> getOutputChain() {
        return outputChain;
    }

    public @NotNull Optional<ActionOutput> getLastOutput() {
        return outputChain.isEmpty() ? Optional.empty() : Optional.of(outputChain.get(outputChain.size() - 1));
    }

    public @NotNull ActionMessage withEvent(@Nullable Object event) {
        return new ActionMessage(event, nodes, users, activities, outputChain);
    }

    public @NotNull ActionMessage withNodes(@NotNull List<Node> nodes) {
        return new ActionMessage(event, ImmutableList.copyOf(nodes), users, activities, outputChain);
    }

    public @NotNull ActionMessage withUsers(@NotNull List<User> users) {
        return new ActionMessage(event, nodes, ImmutableList.copyOf(users), activities, outputChain);
    }

    public @NotNull ActionMessage withActivities(@NotNull List<ActivityObject> activities) {
        return new ActionMessage(event, nodes, users, ImmutableList.copyOf(activities), outputChain);
    }

    public @NotNull ActionMessage withOutput(@NotNull ActionOutput output) {
        ImmutableList<ActionOutput> chain = ImmutableList.<ActionOutput>builderWithExpectedSize(outputChain.size() + 1)
                .addAll(outputChain)
                .add(Objects.requireNonNull(output))
                .build();
        return new ActionMessage(event, nodes, users, activities, chain);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionMessage that = (ActionMessage) o;
        return Objects.equals(event, that.event) && nodes.equals(that.nodes) && users.equals(that.users)
                && activities.equals(that.activities) && outputChain.equals(that.outputChain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, nodes, users, activities, outputChain);
    }

    @Override
    public String toString() {
        return "ActionMessage{" +
                (event != null ? "event=" + event + ", " : "") +
                "nodes=" + nodes.size() +
                ", users=" + users.size() +
                ", activities=" + activities.size() +
                ", outputs=" + outputChain.size() +
                '}';
    }
}
