package hle.affinity.pool;

/**
 * Thrown when the pool cannot create its initial minimum set of resources.
 * The partially built pool has already been torn down when this is thrown.
 */
public class PoolConstructionException extends ResourcePoolException {

    public PoolConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
