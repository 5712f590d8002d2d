package io.github.byzatic.jobs.model;

public enum Command {
    NONE,
    PAUSE,
    RESUME,
    STOP,
    DELETE,
    RUN_ONCE,
    INACTIVE,
    ACTIVE
}
