package hle.affinity.pool;

/**
 * Thrown when a resource is requested from a pool that is closing or closed.
 */
public class PoolShutdownException extends ResourcePoolException {

    public PoolShutdownException() {
        super("Pool is shut down");
    }
}
