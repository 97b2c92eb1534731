package hle.affinity.pool;

import java.time.Duration;

/**
 * Configuration for {@link AffinityPool}.
 * Uses the builder pattern for flexible configuration.
 *
 * <p>The builder accepts any values; {@link #normalize()} replaces out-of-range values
 * with defaults and is applied once by the pool at construction time:
 * <ul>
 *   <li>maxPoolSize &lt;= 0 becomes 1</li>
 *   <li>minPoolSize &lt; 1 becomes 1, and is clamped down to maxPoolSize</li>
 *   <li>missing or non-positive durations fall back to their defaults</li>
 * </ul>
 */
public final class AffinityPoolConfig {

    public static final String DEFAULT_ENTRY_POINT = "default";
    public static final int DEFAULT_MIN_POOL_SIZE = 1;
    public static final int DEFAULT_MAX_POOL_SIZE = 1;
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_WAIT_CONN_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_COMMAND_QUEUE_CAPACITY = 100;
    public static final Duration DEFAULT_COMMAND_SUBMIT_TIMEOUT = Duration.ofSeconds(10);

    private final String connectionTarget;
    private final String entryPoint;
    private final int minPoolSize;
    private final int maxPoolSize;
    private final Duration idleTimeout;
    private final Duration waitConnTimeout;
    private final Duration cleanupInterval;
    private final Duration workerShutdownTimeout;
    private final int commandQueueCapacity;
    private final Duration commandSubmitTimeout;

    private AffinityPoolConfig(Builder builder) {
        this.connectionTarget = builder.connectionTarget;
        this.entryPoint = builder.entryPoint;
        this.minPoolSize = builder.minPoolSize;
        this.maxPoolSize = builder.maxPoolSize;
        this.idleTimeout = builder.idleTimeout;
        this.waitConnTimeout = builder.waitConnTimeout;
        this.cleanupInterval = builder.cleanupInterval;
        this.workerShutdownTimeout = builder.workerShutdownTimeout;
        this.commandQueueCapacity = builder.commandQueueCapacity;
        this.commandSubmitTimeout = builder.commandSubmitTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration: one resource, default timeouts.
     */
    public static AffinityPoolConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Returns a copy of this configuration with every invariant established.
     * Normalizing an already normalized configuration returns an equal configuration.
     */
    public AffinityPoolConfig normalize() {
        int max = maxPoolSize <= 0 ? DEFAULT_MAX_POOL_SIZE : maxPoolSize;
        int min = minPoolSize < 1 ? DEFAULT_MIN_POOL_SIZE : minPoolSize;
        if (min > max) {
            min = max;
        }
        return toBuilder()
                .connectionTarget(connectionTarget == null ? "" : connectionTarget)
                .entryPoint(entryPoint == null || entryPoint.isBlank() ? DEFAULT_ENTRY_POINT : entryPoint)
                .minPoolSize(min)
                .maxPoolSize(max)
                .idleTimeout(positiveOr(idleTimeout, DEFAULT_IDLE_TIMEOUT))
                .waitConnTimeout(positiveOr(waitConnTimeout, DEFAULT_WAIT_CONN_TIMEOUT))
                .cleanupInterval(positiveOr(cleanupInterval, DEFAULT_CLEANUP_INTERVAL))
                .workerShutdownTimeout(positiveOr(workerShutdownTimeout, DEFAULT_WORKER_SHUTDOWN_TIMEOUT))
                .commandQueueCapacity(commandQueueCapacity <= 0 ? DEFAULT_COMMAND_QUEUE_CAPACITY : commandQueueCapacity)
                .commandSubmitTimeout(positiveOr(commandSubmitTimeout, DEFAULT_COMMAND_SUBMIT_TIMEOUT))
                .build();
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .connectionTarget(connectionTarget)
                .entryPoint(entryPoint)
                .minPoolSize(minPoolSize)
                .maxPoolSize(maxPoolSize)
                .idleTimeout(idleTimeout)
                .waitConnTimeout(waitConnTimeout)
                .cleanupInterval(cleanupInterval)
                .workerShutdownTimeout(workerShutdownTimeout)
                .commandQueueCapacity(commandQueueCapacity)
                .commandSubmitTimeout(commandSubmitTimeout);
    }

    public String getConnectionTarget() {
        return connectionTarget;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public int getMinPoolSize() {
        return minPoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getWaitConnTimeout() {
        return waitConnTimeout;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public Duration getWorkerShutdownTimeout() {
        return workerShutdownTimeout;
    }

    public int getCommandQueueCapacity() {
        return commandQueueCapacity;
    }

    public Duration getCommandSubmitTimeout() {
        return commandSubmitTimeout;
    }

    @Override
    public String toString() {
        return String.format("AffinityPoolConfig[target=%s, entryPoint=%s, min=%d, max=%d, idleTimeout=%s, "
                        + "waitConnTimeout=%s, cleanupInterval=%s, workerShutdownTimeout=%s, queue=%d, submitTimeout=%s]",
                connectionTarget, entryPoint, minPoolSize, maxPoolSize, idleTimeout,
                waitConnTimeout, cleanupInterval, workerShutdownTimeout, commandQueueCapacity, commandSubmitTimeout);
    }

    public static class Builder {
        private String connectionTarget = "";
        private String entryPoint = DEFAULT_ENTRY_POINT;
        private int minPoolSize = DEFAULT_MIN_POOL_SIZE;
        private int maxPoolSize = DEFAULT_MAX_POOL_SIZE;
        private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
        private Duration waitConnTimeout = DEFAULT_WAIT_CONN_TIMEOUT;
        private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
        private Duration workerShutdownTimeout = DEFAULT_WORKER_SHUTDOWN_TIMEOUT;
        private int commandQueueCapacity = DEFAULT_COMMAND_QUEUE_CAPACITY;
        private Duration commandSubmitTimeout = DEFAULT_COMMAND_SUBMIT_TIMEOUT;

        private Builder() {}

        /**
         * Sets the backend connection string, passed verbatim to the backend.
         * Default: empty
         */
        public Builder connectionTarget(String connectionTarget) {
            this.connectionTarget = connectionTarget;
            return this;
        }

        /**
         * Sets the backend entry-point identifier (the object or handler the backend
         * instantiates for each resource).
         * Default: "default"
         */
        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        /**
         * Sets the number of resources created up front and kept through idle eviction.
         * Default: 1
         */
        public Builder minPoolSize(int minPoolSize) {
            this.minPoolSize = minPoolSize;
            return this;
        }

        /**
         * Sets the maximum number of live resources.
         * Default: 1
         */
        public Builder maxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        /**
         * Sets how long a resource can remain idle before being eligible for eviction.
         * Default: 5 minutes
         */
        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        /**
         * Sets how long an acquire waits for a free resource before trying to grow the pool.
         * Default: 10 seconds
         */
        public Builder waitConnTimeout(Duration waitConnTimeout) {
            this.waitConnTimeout = waitConnTimeout;
            return this;
        }

        /**
         * How often the idle reaper runs.
         * Default: 60 seconds
         */
        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        /**
         * How long closing a resource waits for its worker thread to exit.
         * Default: 30 seconds
         */
        public Builder workerShutdownTimeout(Duration workerShutdownTimeout) {
            this.workerShutdownTimeout = workerShutdownTimeout;
            return this;
        }

        /**
         * Maximum number of commands queued on a single worker.
         * Default: 100
         */
        public Builder commandQueueCapacity(int commandQueueCapacity) {
            this.commandQueueCapacity = commandQueueCapacity;
            return this;
        }

        /**
         * How long a submitter waits for room in a full worker queue.
         * Default: 10 seconds
         */
        public Builder commandSubmitTimeout(Duration commandSubmitTimeout) {
            this.commandSubmitTimeout = commandSubmitTimeout;
            return this;
        }

        public AffinityPoolConfig build() {
            return new AffinityPoolConfig(this);
        }
    }
}
