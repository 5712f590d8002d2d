package io.github.byzatic.jobs.base_exceptions;

/**
 * A job, schedule, selector or action definition that cannot be used as given.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(Throwable cause) {
        super(cause);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(Throwable cause, String message) {
        super(message, cause);
    }
}
