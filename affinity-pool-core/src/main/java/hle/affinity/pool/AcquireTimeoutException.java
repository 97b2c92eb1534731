package hle.affinity.pool;

import java.time.Duration;

/**
 * Thrown when no resource became free within the wait timeout and the pool
 * could not grow because it is already at its maximum size.
 * Callers may retry with backoff.
 */
public class AcquireTimeoutException extends ResourcePoolException {

    private final Duration waited;

    public AcquireTimeoutException(Duration waited) {
        super("Timeout waiting for a free resource after " + waited.toMillis() + "ms");
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}
