package io.github.byzatic.jobs.model;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;

public final class User {
    private final String uuid;
    private final String login;
    private final String groupPath;
    private final ImmutableMap<String, String> attributes;

    public User(String uuid, String login, String groupPath, Map<String, String> attributes) {
        this.uuid = uuid == null ? "" : uuid;
        this.login = login == null ? "" : login;
        this.groupPath = groupPath == null ? "/" : groupPath;
        this.attributes = attributes == null ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
    }

    public User(String uuid, String login) {
        this(uuid, login, "/", null);
    }

    public @NotNull String getUuid() {
        return uuid;
    }

    public @NotNull String getLogin() {
        return login;
    }

    public @NotNull String getGroupPath() {
        return groupPath;
    }

    public @NotNull Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User user = (User) o;
        return uuid.equals(user.uuid) && login.equals(user.login) && groupPath.equals(user.groupPath)
                && attributes.equals(user.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, login, groupPath, attributes);
    }

    @Override
    public String toString() {
        return "User{uuid='" + uuid + "', login='" + login + "', groupPath='" + groupPath + "'}";
    }
}
