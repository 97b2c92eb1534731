package hle.affinity.backend;

import hle.affinity.pool.AffinityPoolConfig;

/**
 * Creates resource instances for the pool.
 * This is the only place where backend-specific initialization (connecting,
 * handshakes, loading server-side handlers) happens.
 *
 * <p>The pool always calls {@link #initialize(AffinityPoolConfig)} on the dedicated
 * worker thread that will own the returned handle for its entire lifetime.
 */
@FunctionalInterface
public interface ResourceBackend {

    /**
     * Constructs and initializes one resource instance.
     *
     * @param config the normalized pool configuration (connection target, entry point)
     * @return an initialized handle, never null
     * @throws ResourceInitializationException if the resource could not be made usable
     */
    ResourceHandle initialize(AffinityPoolConfig config) throws ResourceInitializationException;
}
