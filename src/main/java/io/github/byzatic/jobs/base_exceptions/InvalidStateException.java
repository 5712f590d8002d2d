package io.github.byzatic.jobs.base_exceptions;

/**
 * A control command is not applicable to the current status of its target.
 */
public class InvalidStateException extends Exception {
    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(Throwable cause) {
        super(cause);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidStateException(Throwable cause, String message) {
        super(message, cause);
    }
}
