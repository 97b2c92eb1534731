package hle.affinity.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Tracks the sub-resources a handle acquires while it initializes, so they can be
 * released in reverse acquisition order.
 *
 * <p>Backends use one instance per handle: register every object right after it is
 * obtained, call {@link #releaseAll()} if a later initialization step fails, and call
 * it again from {@link ResourceHandle#release()}. Not thread-safe; it lives on the
 * worker thread together with its handle.
 *
 * <pre>{@code
 * HandleResources resources = new HandleResources("conn-" + id);
 * try {
 *     Session session = resources.register(connector.connect(target));
 *     Processor processor = resources.register(session.load(entryPoint));
 *     return new MyHandle(processor, resources);
 * } catch (RuntimeException e) {
 *     resources.releaseAll();
 *     throw new ResourceInitializationException("initialization failed", e);
 * }
 * }</pre>
 */
public final class HandleResources {

    private static final Logger logger = LoggerFactory.getLogger(HandleResources.class);

    private final String owner;
    private final Deque<AutoCloseable> acquired = new ArrayDeque<>();

    public HandleResources(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner cannot be null");
    }

    /**
     * Registers a sub-resource and returns it.
     */
    public <C extends AutoCloseable> C register(C resource) {
        Objects.requireNonNull(resource, "resource cannot be null");
        acquired.push(resource);
        return resource;
    }

    /**
     * Releases all registered sub-resources, most recently acquired first.
     * A failing release is logged and does not stop the remaining ones.
     *
     * @return the number of sub-resources released without error
     */
    public int releaseAll() {
        int released = 0;
        while (!acquired.isEmpty()) {
            AutoCloseable resource = acquired.pop();
            try {
                resource.close();
                released++;
            } catch (Exception e) {
                logger.warn("Failed to release {} of {}: {}", resource, owner, e.getMessage());
            }
        }
        return released;
    }

    /**
     * Returns the number of sub-resources still held.
     */
    public int size() {
        return acquired.size();
    }
}
