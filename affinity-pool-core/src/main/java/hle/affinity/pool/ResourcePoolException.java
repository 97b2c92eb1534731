package hle.affinity.pool;

/**
 * Base exception for failures raised by the affinity pool.
 */
public class ResourcePoolException extends RuntimeException {

    public ResourcePoolException(String message) {
        super(message);
    }

    public ResourcePoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
