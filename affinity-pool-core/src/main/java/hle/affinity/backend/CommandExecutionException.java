package hle.affinity.backend;

import hle.affinity.pool.ResourcePoolException;

/**
 * Exception thrown when a backend reports that a command failed.
 * The resource that ran the command stays in service.
 */
public class CommandExecutionException extends ResourcePoolException {

    private final boolean retryable;

    public CommandExecutionException(String message) {
        super(message);
        this.retryable = false;
    }

    public CommandExecutionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public CommandExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = false;
    }

    public CommandExecutionException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Returns true if the same command may succeed when sent again (e.g. a transient backend error).
     */
    public boolean isRetryable() {
        return retryable;
    }
}
