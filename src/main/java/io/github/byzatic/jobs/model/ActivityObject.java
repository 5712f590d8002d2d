package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An activity-stream object carried along with the nodes and users of a message.
 */
public final class ActivityObject {
    private final String id;
    private final String type;
    private final String name;

    public ActivityObject(@NotNull String id, @NotNull String type, @NotNull String name) {
        this.id = Objects.requireNonNull(id);
        this.type = Objects.requireNonNull(type);
        this.name = Objects.requireNonNull(name);
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull String getType() {
        return type;
    }

    public @NotNull String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActivityObject)) return false;
        ActivityObject that = (ActivityObject) o;
        return id.equals(that.id) && type.equals(that.type) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, name);
    }

    @Override
    public String toString() {
        return "ActivityObject{id='" + id + "', type='" + type + "', name='" + name + "'}";
    }
}
