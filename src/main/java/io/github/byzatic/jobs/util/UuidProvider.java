package io.github.byzatic.jobs.util;


import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Identifiers of tasks and jobs.
 */
public class UuidProvider {

    /**
     * @return a new random UUID as a {@link String}
     */
    public static @NotNull String generateUuidString() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stable identifier derived from a name, e.g. the path of a node.
     */
    public static @NotNull String nameUuidString(@NotNull String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
