package hle.affinity.worker;

import hle.affinity.pool.ResourcePoolException;

/**
 * Thrown when a command cannot be handed to, or answered by, a resource worker:
 * the command queue stayed full past the submit timeout, the worker was stopped,
 * or the waiting thread was interrupted.
 */
public class WorkerUnavailableException extends ResourcePoolException {

    public WorkerUnavailableException(String message) {
        super(message);
    }

    public WorkerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
