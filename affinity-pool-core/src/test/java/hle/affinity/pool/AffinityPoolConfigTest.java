package hle.affinity.pool;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AffinityPoolConfigTest {

    @Test
    void shouldUseDefaults() {
        AffinityPoolConfig config = AffinityPoolConfig.defaultConfig();

        assertEquals("", config.getConnectionTarget());
        assertEquals("default", config.getEntryPoint());
        assertEquals(1, config.getMinPoolSize());
        assertEquals(1, config.getMaxPoolSize());
        assertEquals(Duration.ofMinutes(5), config.getIdleTimeout());
        assertEquals(Duration.ofSeconds(10), config.getWaitConnTimeout());
        assertEquals(Duration.ofSeconds(60), config.getCleanupInterval());
        assertEquals(Duration.ofSeconds(30), config.getWorkerShutdownTimeout());
        assertEquals(100, config.getCommandQueueCapacity());
    }

    @Test
    void shouldReplaceNonPositiveSizes() {
        AffinityPoolConfig config = AffinityPoolConfig.builder()
                .minPoolSize(-3)
                .maxPoolSize(0)
                .commandQueueCapacity(-1)
                .build()
                .normalize();

        assertEquals(1, config.getMinPoolSize());
        assertEquals(1, config.getMaxPoolSize());
        assertEquals(AffinityPoolConfig.DEFAULT_COMMAND_QUEUE_CAPACITY, config.getCommandQueueCapacity());
    }

    @Test
    void shouldRaiseZeroMinimumToOne() {
        AffinityPoolConfig config = AffinityPoolConfig.builder()
                .minPoolSize(0)
                .maxPoolSize(3)
                .build()
                .normalize();

        assertEquals(1, config.getMinPoolSize());
        assertEquals(3, config.getMaxPoolSize());
    }

    @Test
    void shouldClampMinimumToMaximum() {
        AffinityPoolConfig config = AffinityPoolConfig.builder()
                .minPoolSize(8)
                .maxPoolSize(4)
                .build()
                .normalize();

        assertEquals(4, config.getMinPoolSize());
        assertEquals(4, config.getMaxPoolSize());
    }

    @Test
    void shouldReplaceMissingOrNonPositiveDurations() {
        AffinityPoolConfig config = AffinityPoolConfig.builder()
                .idleTimeout(null)
                .waitConnTimeout(Duration.ZERO)
                .cleanupInterval(Duration.ofSeconds(-5))
                .workerShutdownTimeout(null)
                .commandSubmitTimeout(Duration.ZERO)
                .build()
                .normalize();

        assertEquals(AffinityPoolConfig.DEFAULT_IDLE_TIMEOUT, config.getIdleTimeout());
        assertEquals(AffinityPoolConfig.DEFAULT_WAIT_CONN_TIMEOUT, config.getWaitConnTimeout());
        assertEquals(AffinityPoolConfig.DEFAULT_CLEANUP_INTERVAL, config.getCleanupInterval());
        assertEquals(AffinityPoolConfig.DEFAULT_WORKER_SHUTDOWN_TIMEOUT, config.getWorkerShutdownTimeout());
        assertEquals(AffinityPoolConfig.DEFAULT_COMMAND_SUBMIT_TIMEOUT, config.getCommandSubmitTimeout());
    }

    @Test
    void shouldKeepValidValues() {
        AffinityPoolConfig config = AffinityPoolConfig.builder()
                .connectionTarget("srv=primary;db=orders")
                .entryPoint("V83.COMConnector")
                .minPoolSize(2)
                .maxPoolSize(6)
                .idleTimeout(Duration.ofSeconds(30))
                .waitConnTimeout(Duration.ofMillis(250))
                .build()
                .normalize();

        assertEquals("srv=primary;db=orders", config.getConnectionTarget());
        assertEquals("V83.COMConnector", config.getEntryPoint());
        assertEquals(2, config.getMinPoolSize());
        assertEquals(6, config.getMaxPoolSize());
        assertEquals(Duration.ofSeconds(30), config.getIdleTimeout());
        assertEquals(Duration.ofMillis(250), config.getWaitConnTimeout());
    }

    @Test
    void shouldDefaultBlankEntryPoint() {
        AffinityPoolConfig config = AffinityPoolConfig.builder()
                .connectionTarget(null)
                .entryPoint("  ")
                .build()
                .normalize();

        assertEquals("", config.getConnectionTarget());
        assertEquals(AffinityPoolConfig.DEFAULT_ENTRY_POINT, config.getEntryPoint());
    }

    @Test
    void normalizeShouldBeIdempotent() {
        AffinityPoolConfig once = AffinityPoolConfig.builder()
                .minPoolSize(9)
                .maxPoolSize(-1)
                .idleTimeout(Duration.ZERO)
                .build()
                .normalize();
        AffinityPoolConfig twice = once.normalize();

        assertEquals(once.toString(), twice.toString());
    }
}
