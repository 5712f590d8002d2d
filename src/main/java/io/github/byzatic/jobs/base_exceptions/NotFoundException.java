package io.github.byzatic.jobs.base_exceptions;

/**
 * The job, task or command targeted by a request does not exist.
 */
public class NotFoundException extends Exception {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(Throwable cause) {
        super(cause);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public NotFoundException(Throwable cause, String message) {
        super(message, cause);
    }
}
