package hle.affinity.config;

import hle.affinity.dispatch.DispatcherConfig;
import hle.affinity.pool.AffinityPoolConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything the service reads from its configuration file.
 */
public final class ServiceConfig {

    public static final String DEFAULT_LOG_LEVEL = "debug";
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final AffinityPoolConfig pool;
    private final DispatcherConfig dispatcher;
    private final String logLevel;
    private final Duration shutdownTimeout;

    public ServiceConfig(AffinityPoolConfig pool, DispatcherConfig dispatcher, String logLevel,
                         Duration shutdownTimeout) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
        this.logLevel = Objects.requireNonNull(logLevel, "logLevel cannot be null");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout cannot be null");
    }

    /**
     * Returns the configuration used when no file is given.
     */
    public static ServiceConfig defaults() {
        return new ServiceConfig(AffinityPoolConfig.defaultConfig(),
                DispatcherConfig.builder().drainTimeout(DEFAULT_SHUTDOWN_TIMEOUT).build(),
                DEFAULT_LOG_LEVEL, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public AffinityPoolConfig getPool() {
        return pool;
    }

    public DispatcherConfig getDispatcher() {
        return dispatcher;
    }

    public String getLogLevel() {
        return logLevel;
    }

    /**
     * Gets how long shutdown waits for in-flight commands before closing the pool.
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public String toString() {
        return String.format("ServiceConfig[logLevel=%s, shutdownTimeout=%s, pool=%s, dispatcher=%s]",
                logLevel, shutdownTimeout, pool, dispatcher);
    }
}
