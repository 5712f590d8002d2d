package io.github.byzatic.jobs.model;

import org.jetbrains.annotations.NotNull;

public final class CtrlCommandResponse {
    private final String msg;

    public CtrlCommandResponse(@NotNull String msg) {
        this.msg = msg;
    }

    public @NotNull String getMsg() {
        return msg;
    }

    @Override
    public String toString() {
        return "CtrlCommandResponse{msg='" + msg + "'}";
    }
}
