package io.github.byzatic.jobs.base_exceptions;

/**
 * The requesting owner is not allowed to issue a command on the target job.
 */
public class PermissionException extends Exception {
    public PermissionException(String message) {
        super(message);
    }

    public PermissionException(Throwable cause) {
        super(cause);
    }

    public PermissionException(String message, Throwable cause) {
        super(message, cause);
    }

    public PermissionException(Throwable cause, String message) {
        super(message, cause);
    }
}
