package io.github.byzatic.jobs.model;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * A file-like entry of the tree the actions operate on.
 */
public final class Node {
    public enum Type {UNKNOWN, LEAF, COLLECTION}

    private final String uuid;
    private final String path;
    private final Type type;
    private final long size;
    private final long mtime;
    private final ImmutableMap<String, String> metadata;

    private Node(Builder builder) {
        this.uuid = builder.uuid == null ? "" : builder.uuid;
        this.path = builder.path == null ? "" : builder.path;
        this.type = builder.type;
        this.size = builder.size;
        this.mtime = builder.mtime;
        this.metadata = ImmutableMap.copyOf(builder.metadata);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(Node copy) {
        Builder builder = new Builder();
        builder.uuid = copy.uuid;
        builder.path = copy.path;
        builder.type = copy.type;
        builder.size = copy.size;
        builder.mtime = copy.mtime;
        builder.metadata = copy.metadata;
        return builder;
    }

    /**
     * A node known only by its path.
     */
    public static @NotNull Node ofPath(@NotNull String path) {
        return newBuilder().setPath(path).build();
    }

    public @NotNull String getUuid() {
        return uuid;
    }

    public @NotNull String getPath() {
        return path;
    }

    public @NotNull Type getType() {
        return type;
    }

    public long getSize() {
        return size;
    }

    public long getMtime() {
        return mtime;
    }

    public @NotNull Map<String, String> getMetadata() {
        return metadata;
    }

    public @Nullable String getMetadata(String key) {
        return metadata.get(key);
    }

    public boolean isLeaf() {
        return type == Type.LEAF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return size == node.size && mtime == node.mtime && uuid.equals(node.uuid) && path.equals(node.path)
                && type == node.type && metadata.equals(node.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, path, type, size, mtime, metadata);
    }

    @Override
    public String toString() {
        return "Node{" +
                "uuid='" + uuid + '\'' +
                ", path='" + path + '\'' +
                ", type=" + type +
                ", size=" + size +
                '}';
    }

    public static final class Builder {
        private String uuid;
        private String path;
        private Type type = Type.UNKNOWN;
        private long size;
        private long mtime;
        private Map<String, String> metadata = ImmutableMap.of();

        private Builder() {
        }

        public Builder setUuid(String uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder setPath(String path) {
            this.path = path;
            return this;
        }

        public Builder setType(Type type) {
            this.type = Objects.requireNonNull(type);
            return this;
        }

        public Builder setSize(long size) {
            this.size = size;
            return this;
        }

        public Builder setMtime(long mtime) {
            this.mtime = mtime;
            return this;
        }

        public Builder setMetadata(Map<String, String> metadata) {
            this.metadata = Objects.requireNonNull(metadata);
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
