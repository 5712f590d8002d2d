package io.github.byzatic.jobs.catalog;

import com.google.common.collect.Lists;
import io.github.byzatic.jobs.model.User;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCatalogTest {

    @Test
    void pagesKeepInsertionOrder() {
        InMemoryCatalog<User> users = InMemoryCatalog.ofUsers();
        users.add(new User("1", "zed"), new User("2", "amy"), new User("3", "kim"));
        assertEquals(List.of("zed", "amy"), users.page(0, 2).stream().map(User::getLogin).collect(Collectors.toList()));
        assertEquals(List.of("kim"), users.page(2, 2).stream().map(User::getLogin).collect(Collectors.toList()));
        assertTrue(users.page(5, 2).isEmpty());
        assertEquals(Optional.of(new User("2", "amy")), users.lookup("amy"));
        assertTrue(users.remove("amy"));
        assertEquals(2, users.size());
    }

    @Test
    void pagedIteratorWalksEveryPage() {
        InMemoryCatalog<User> users = InMemoryCatalog.ofUsers();
        for (int i = 0; i < 11; i++) users.add(new User("u" + i, "user" + i));
        List<User> all = Lists.newArrayList(new PagedIterator<>(users, 4));
        assertEquals(11, all.size());
        assertEquals("user10", all.get(10).getLogin());
    }

    @Test
    void pagedIteratorWrapsCatalogFailures() {
        EntityCatalog<User> broken = new EntityCatalog<>() {
            @Override
            public List<User> page(int offset, int limit) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public Optional<User> lookup(String key) {
                return Optional.empty();
            }
        };
        PagedIterator<User> it = new PagedIterator<>(broken, 5);
        UncheckedIOException e = assertThrows(UncheckedIOException.class, it::hasNext);
        assertEquals("disk gone", e.getCause().getMessage());
    }
}
