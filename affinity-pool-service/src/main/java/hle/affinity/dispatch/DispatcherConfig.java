package hle.affinity.dispatch;

import java.time.Duration;

/**
 * Configuration for {@link CommandDispatcher}.
 *
 * <p>The concurrency should match what the pool can serve: more dispatcher threads
 * than {@code maxPoolSize} only makes callers wait in acquire instead of the queue.
 */
public class DispatcherConfig {

    private final int concurrency;
    private final int queueCapacity;
    private final boolean daemon;
    private final String threadNamePrefix;
    private final RejectionPolicy rejectionPolicy;
    private final Duration drainTimeout;

    private DispatcherConfig(Builder builder) {
        this.concurrency = builder.concurrency;
        this.queueCapacity = builder.queueCapacity;
        this.daemon = builder.daemon;
        this.threadNamePrefix = builder.threadNamePrefix;
        this.rejectionPolicy = builder.rejectionPolicy;
        this.drainTimeout = builder.drainTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DispatcherConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .concurrency(concurrency)
                .queueCapacity(queueCapacity)
                .daemon(daemon)
                .threadNamePrefix(threadNamePrefix)
                .rejectionPolicy(rejectionPolicy)
                .drainTimeout(drainTimeout);
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public RejectionPolicy getRejectionPolicy() {
        return rejectionPolicy;
    }

    /**
     * Gets how long {@link CommandDispatcher#close()} waits for queued commands.
     */
    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    @Override
    public String toString() {
        return String.format("DispatcherConfig[concurrency=%d, queue=%d, policy=%s, drainTimeout=%s]",
                concurrency, queueCapacity, rejectionPolicy, drainTimeout);
    }

    /**
     * Policy for handling commands when the queue is full.
     */
    public enum RejectionPolicy {
        /** Block the submitting thread until space is available */
        BLOCK,
        /** Fail the command immediately */
        REJECT,
        /** Run the command in the calling thread */
        CALLER_RUNS
    }

    public static class Builder {
        private int concurrency = 10;
        private int queueCapacity = 1000;
        private boolean daemon = false;
        private String threadNamePrefix = "command-dispatcher";
        private RejectionPolicy rejectionPolicy = RejectionPolicy.BLOCK;
        private Duration drainTimeout = Duration.ofSeconds(10);

        private Builder() {}

        /**
         * Sets the maximum number of commands in flight against the pool.
         *
         * Default: 10
         */
        public Builder concurrency(int concurrency) {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be >= 1");
            }
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sets the maximum number of commands waiting for a dispatcher thread.
         * When exceeded, the rejection policy is applied.
         *
         * Default: 1000
         */
        public Builder queueCapacity(int queueCapacity) {
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("queueCapacity must be >= 1");
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * Default: false
         */
        public Builder daemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        /**
         * Prefix for dispatcher thread names.
         *
         * Default: "command-dispatcher"
         */
        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        /**
         * Default: BLOCK
         */
        public Builder rejectionPolicy(RejectionPolicy rejectionPolicy) {
            if (rejectionPolicy == null) {
                throw new IllegalArgumentException("rejectionPolicy cannot be null");
            }
            this.rejectionPolicy = rejectionPolicy;
            return this;
        }

        /**
         * Sets how long closing the dispatcher waits for queued commands to finish
         * before it cancels them and closes the pool.
         *
         * Default: 10 seconds
         */
        public Builder drainTimeout(Duration drainTimeout) {
            if (drainTimeout == null || drainTimeout.isNegative()) {
                throw new IllegalArgumentException("drainTimeout must be >= 0");
            }
            this.drainTimeout = drainTimeout;
            return this;
        }

        public DispatcherConfig build() {
            return new DispatcherConfig(this);
        }
    }
}
