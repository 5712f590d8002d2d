package io.github.byzatic.jobs.selectors;

import com.google.common.collect.ImmutableList;
import io.github.byzatic.jobs.model.Query;
import io.github.byzatic.jobs.model.User;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class UsersSelector extends Selector {
    private final boolean all;
    private final ImmutableList<User> users;
    private final boolean collect;

    private UsersSelector(Builder builder) {
        super(builder.query);
        this.all = builder.all;
        this.users = ImmutableList.copyOf(builder.users);
        this.collect = builder.collect;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.USERS;
    }

    @Override
    public boolean isAll() {
        return all;
    }

    @Override
    public boolean isCollect() {
        return collect;
    }

    public @NotNull List<User> getUsers() {
        return users;
    }

    public boolean hasPreset() {
        return !users.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UsersSelector that = (UsersSelector) o;
        return all == that.all && collect == that.collect && users.equals(that.users)
                && Objects.equals(getQuery(), that.getQuery());
    }

    @Override
    public int hashCode() {
        return Objects.hash(all, users, getQuery(), collect);
    }

    @Override
    public String toString() {
        return "UsersSelector{all=" + all + ", users=" + users.size() + ", query=" + getQuery()
                + ", collect=" + collect + '}';
    }

    public static final class Builder {
        private boolean all;
        private final List<User> users = new ArrayList<>();
        private Query query;
        private boolean collect;

        private Builder() {
        }

        public Builder all(boolean all) {
            this.all = all;
            return this;
        }

        public Builder users(User... users) {
            this.users.addAll(Arrays.asList(users));
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

        public UsersSelector build() {
            return new UsersSelector(this);
        }
    }
}
