package hle.affinity.simulated;

import hle.affinity.backend.HandleResources;
import hle.affinity.backend.ResourceBackend;
import hle.affinity.backend.ResourceHandle;
import hle.affinity.backend.ResourceInitializationException;
import hle.affinity.pool.AffinityPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A simulated thread-affine backend for demos and tests.
 *
 * <p>Each handle goes through three initialization steps, each producing a
 * sub-resource: connect to {@code connectionTarget}, resolve {@code entryPoint}, load
 * the command handler. A failing step releases the steps before it in reverse order.
 * Handles refuse calls from any thread other than the one that created them, the way
 * single-threaded-apartment components do.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable response time (simulates backend latency)</li>
 *   <li>Configurable failure rate (simulates backend errors)</li>
 *   <li>Configurable failing initialization step</li>
 *   <li>Counters for created handles, open sub-resources and executed commands</li>
 * </ul>
 */
public class SimulatedBackend implements ResourceBackend {

    static final String STEP_CONNECT = "connect";
    static final String STEP_ENTRY_POINT = "entry-point";
    static final String STEP_HANDLER = "handler";

    private static final Logger logger = LoggerFactory.getLogger(SimulatedBackend.class);

    private final long minLatencyMs;
    private final long maxLatencyMs;
    private final double failureRate;
    private final String failingStep;

    private final AtomicInteger handleCount = new AtomicInteger(0);
    private final AtomicInteger liveHandles = new AtomicInteger(0);
    private final AtomicInteger openSubResources = new AtomicInteger(0);
    private final AtomicInteger commandCount = new AtomicInteger(0);

    private SimulatedBackend(Builder builder) {
        this.minLatencyMs = builder.minLatencyMs;
        this.maxLatencyMs = builder.maxLatencyMs;
        this.failureRate = builder.failureRate;
        this.failingStep = builder.failingStep;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ResourceHandle initialize(AffinityPoolConfig config) {
        int number = handleCount.incrementAndGet();
        String id = "simulated-" + number;
        HandleResources resources = new HandleResources(id);
        try {
            resources.register(open(id, STEP_CONNECT, config.getConnectionTarget()));
            resources.register(open(id, STEP_ENTRY_POINT, config.getEntryPoint()));
            resources.register(open(id, STEP_HANDLER, "command-handler"));
        } catch (ResourceInitializationException e) {
            int released = resources.releaseAll();
            logger.warn("Initialization of {} failed, released {} sub-resources", id, released);
            throw e;
        }
        liveHandles.incrementAndGet();
        logger.debug("Initialized {} on {}", id, Thread.currentThread().getName());
        return new SimulatedHandle(id, this, resources);
    }

    private SubResource open(String owner, String step, String target) {
        if (step.equals(failingStep)) {
            throw new ResourceInitializationException(
                    String.format("%s: step %s failed for \"%s\"", owner, step, target));
        }
        openSubResources.incrementAndGet();
        return new SubResource(step, target);
    }

    long nextLatencyMs(double sample) {
        return minLatencyMs + (long) (sample * (maxLatencyMs - minLatencyMs));
    }

    double getFailureRate() {
        return failureRate;
    }

    void commandExecuted() {
        commandCount.incrementAndGet();
    }

    void handleReleased() {
        liveHandles.decrementAndGet();
    }

    /**
     * Gets the number of handles this backend attempted to create.
     */
    public int getHandleCount() {
        return handleCount.get();
    }

    /**
     * Gets the number of handles initialized and not yet released.
     */
    public int getLiveHandles() {
        return liveHandles.get();
    }

    /**
     * Gets the number of sub-resources opened by initialization and not yet released.
     */
    public int getOpenSubResources() {
        return openSubResources.get();
    }

    public int getCommandCount() {
        return commandCount.get();
    }

    private final class SubResource implements AutoCloseable {
        private final String step;
        private final String target;

        SubResource(String step, String target) {
            this.step = step;
            this.target = target;
        }

        @Override
        public void close() {
            openSubResources.decrementAndGet();
        }

        @Override
        public String toString() {
            return step + "(" + target + ")";
        }
    }

    /**
     * Builder for creating SimulatedBackend with fluent API.
     */
    public static class Builder {
        private long minLatencyMs = 5;
        private long maxLatencyMs = 20;
        private double failureRate = 0.0;
        private String failingStep;

        private Builder() {}

        public Builder latency(long minMs, long maxMs) {
            if (minMs < 0 || maxMs < minMs) {
                throw new IllegalArgumentException("latency must satisfy 0 <= min <= max");
            }
            this.minLatencyMs = minMs;
            this.maxLatencyMs = maxMs;
            return this;
        }

        public Builder failureRate(double rate) {
            if (rate < 0.0 || rate > 1.0) {
                throw new IllegalArgumentException("failureRate must be between 0.0 and 1.0");
            }
            this.failureRate = rate;
            return this;
        }

        /**
         * Makes every initialization fail at the named step
         * ({@code connect}, {@code entry-point} or {@code handler}).
         */
        public Builder failingStep(String step) {
            this.failingStep = step;
            return this;
        }

        public SimulatedBackend build() {
            return new SimulatedBackend(this);
        }
    }
}
