package dev.jobmatcher.exception;

/**
 * Thrown when the inventory or the subscriptions cannot be loaded.
 * The only failure that aborts a matching pass.
 */
public class FetchFailureException extends RuntimeException {

    public FetchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
