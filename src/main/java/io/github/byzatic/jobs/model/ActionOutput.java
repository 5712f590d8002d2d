package io.github.byzatic.jobs.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.byzatic.jobs.util.Jsons;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Result of one action invocation. Only {@link #isSuccess()} is always meaningful.
 */
public final class ActionOutput {
    private static final byte[] EMPTY = new byte[0];

    private final boolean success;
    private final byte[] rawBody;
    private final String stringBody;
    private final byte[] jsonBody;
    private final String errorString;
    private final boolean ignored;
    private final Duration time;

    private ActionOutput(Builder builder) {
        this.success = builder.success;
        this.rawBody = builder.rawBody;
        this.stringBody = builder.stringBody;
        this.jsonBody = builder.jsonBody;
        this.errorString = builder.errorString;
        this.ignored = builder.ignored;
        this.time = builder.time;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(ActionOutput copy) {
        Builder builder = new Builder();
        builder.success = copy.success;
        builder.rawBody = copy.rawBody;
        builder.stringBody = copy.stringBody;
        builder.jsonBody = copy.jsonBody;
        builder.errorString = copy.errorString;
        builder.ignored = copy.ignored;
        builder.time = copy.time;
        return builder;
    }

    public static @NotNull ActionOutput success(String stringBody) {
        return newBuilder().setSuccess(true).setStringBody(stringBody).build();
    }

    public static @NotNull ActionOutput failure(String errorString) {
        return newBuilder().setSuccess(false).setErrorString(errorString).build();
    }

    /**
     * The action was skipped on purpose. An ignored output is successful.
     */
    public static @NotNull ActionOutput ignored(String reason) {
        return newBuilder().setSuccess(true).setIgnored(true).setStringBody(reason).build();
    }

    public boolean isSuccess() {
        return success;
    }

    public byte[] getRawBody() {
        return rawBody.clone();
    }

    public @NotNull String getStringBody() {
        return stringBody;
    }

    public byte[] getJsonBody() {
        return jsonBody.clone();
    }

    public boolean hasJsonBody() {
        return jsonBody.length > 0;
    }

    public @NotNull JsonNode readJsonBody() {
        return hasJsonBody() ? Jsons.readTree(jsonBody) : MissingNode.getInstance();
    }

    public @NotNull String getErrorString() {
        return errorString;
    }

    public boolean isIgnored() {
        return ignored;
    }

    public @NotNull Duration getTime() {
        return time;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionOutput that = (ActionOutput) o;
        return success == that.success && ignored == that.ignored && Arrays.equals(rawBody, that.rawBody)
                && stringBody.equals(that.stringBody) && Arrays.equals(jsonBody, that.jsonBody)
                && errorString.equals(that.errorString) && time.equals(that.time);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(success, stringBody, errorString, ignored, time);
        result = 31 * result + Arrays.hashCode(rawBody);
        result = 31 * result + Arrays.hashCode(jsonBody);
        return result;
    }

    @Override
    public String toString() {
        return "ActionOutput{" +
                "success=" + success +
                (ignored ? ", ignored" : "") +
                (stringBody.isEmpty() ? "" : ", stringBody='" + stringBody + '\'') +
                (jsonBody.length == 0 ? "" : ", jsonBody=" + new String(jsonBody, StandardCharsets.UTF_8)) +
                (errorString.isEmpty() ? "" : ", error='" + errorString + '\'') +
                ", time=" + time +
                '}';
    }

    public static final class Builder {
        private boolean success;
        private byte[] rawBody = EMPTY;
        private String stringBody = "";
        private byte[] jsonBody = EMPTY;
        private String errorString = "";
        private boolean ignored;
        private Duration time = Duration.ZERO;

        private Builder() {
        }

        public Builder setSuccess(boolean success) {
            this.success = success;
            return this;
        }

        public Builder setRawBody(byte[] rawBody) {
            this.rawBody = rawBody == null ? EMPTY : rawBody.clone();
            return this;
        }

        public Builder setStringBody(String stringBody) {
            this.stringBody = stringBody == null ? "" : stringBody;
            return this;
        }

        public Builder setJsonBody(byte[] jsonBody) {
            this.jsonBody = jsonBody == null ? EMPTY : jsonBody.clone();
            return this;
        }

        /**
         * Serializes {@code value} with Jackson.
         */
        public Builder setJsonBody(Object value) {
            this.jsonBody = Jsons.toJsonBytes(value);
            return this;
        }

        public Builder setErrorString(String errorString) {
            this.errorString = errorString == null ? "" : errorString;
            return this;
        }

        public Builder setIgnored(boolean ignored) {
            this.ignored = ignored;
            return this;
        }

        public Builder setTime(Duration time) {
            this.time = Objects.requireNonNull(time);
            return this;
        }

        public ActionOutput build() {
            return new ActionOutput(this);
        }
    }
}
