package hle.affinity.simulated;

import hle.affinity.backend.CommandExecutionException;
import hle.affinity.backend.HandleResources;
import hle.affinity.backend.ResourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Random;

/**
 * Handle created by {@link SimulatedBackend}. Bound to its creating thread.
 *
 * <p>Operations: {@code echo} returns the params, {@code upper} returns them upper-cased,
 * {@code fail} always fails with a retryable error. Any operation may also fail at the
 * backend's configured failure rate.
 */
public class SimulatedHandle implements ResourceHandle {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedHandle.class);

    private final String id;
    private final SimulatedBackend backend;
    private final HandleResources resources;
    private final Thread owner;
    private final Random random = new Random();
    private int requestCount;
    private boolean released;

    SimulatedHandle(String id, SimulatedBackend backend, HandleResources resources) {
        this.id = id;
        this.backend = backend;
        this.resources = resources;
        this.owner = Thread.currentThread();
    }

    @Override
    public Object execute(String operation, String params) throws CommandExecutionException {
        checkOwner(operation);
        if (released) {
            throw new CommandExecutionException(id + " is released");
        }
        requestCount++;
        logger.trace("{} executing #{} {} on {}", id, requestCount, operation, owner.getName());

        long latency = backend.nextLatencyMs(random.nextDouble());
        try {
            Thread.sleep(latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandExecutionException("Request interrupted", e, true);
        }
        backend.commandExecuted();

        if ("fail".equals(operation) || random.nextDouble() < backend.getFailureRate()) {
            throw new CommandExecutionException(
                    String.format("Simulated backend error for %s(%s) on %s", operation, params, id), true);
        }
        switch (operation) {
            case "echo":
                return params == null ? "" : params;
            case "upper":
                return params == null ? "" : params.toUpperCase(Locale.ROOT);
            default:
                throw new CommandExecutionException("Unknown command " + operation);
        }
    }

    @Override
    public void release() {
        checkOwner("release");
        if (released) {
            return;
        }
        released = true;
        int count = resources.releaseAll();
        backend.handleReleased();
        logger.debug("Released {} after {} requests, {} sub-resources closed", id, requestCount, count);
    }

    private void checkOwner(String operation) {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException(String.format("%s called from %s but is bound to %s",
                    operation, Thread.currentThread().getName(), owner.getName()));
        }
    }

    public String getId() {
        return id;
    }

    /**
     * Gets the number of commands this handle has run. Only meaningful on the owning thread.
     */
    public int getRequestCount() {
        return requestCount;
    }
}
