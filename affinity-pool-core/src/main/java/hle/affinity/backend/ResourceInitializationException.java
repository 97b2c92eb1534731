package hle.affinity.backend;

import hle.affinity.pool.ResourcePoolException;

/**
 * Thrown by a {@link ResourceBackend} when a resource instance could not be initialized.
 */
public class ResourceInitializationException extends ResourcePoolException {

    public ResourceInitializationException(String message) {
        super(message);
    }

    public ResourceInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
