package hle.affinity.simulated;

import hle.affinity.backend.CommandExecutionException;
import hle.affinity.backend.ResourceHandle;
import hle.affinity.backend.ResourceInitializationException;
import hle.affinity.pool.AffinityPool;
import hle.affinity.pool.AffinityPoolConfig;
import hle.affinity.pool.PoolConstructionException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SimulatedBackend.
 */
class SimulatedBackendTest {

    private static SimulatedBackend fastBackend() {
        return SimulatedBackend.builder()
                .latency(0, 1)
                .failureRate(0)
                .build();
    }

    @Test
    void shouldExecuteOperations() {
        SimulatedBackend backend = fastBackend();
        ResourceHandle handle = backend.initialize(AffinityPoolConfig.defaultConfig());

        assertEquals("hello", handle.execute("echo", "hello"));
        assertEquals("HELLO", handle.execute("upper", "hello"));
        assertEquals(2, backend.getCommandCount());
        assertEquals(2, ((SimulatedHandle) handle).getRequestCount());
        handle.release();
    }

    @Test
    void shouldEchoEmptyPayloadWithoutParams() {
        SimulatedBackend backend = fastBackend();

        try (AffinityPool pool = new AffinityPool(AffinityPoolConfig.defaultConfig(), backend)) {
            assertArrayEquals(new byte[0], pool.executeCommand("echo", null));
            assertArrayEquals(new byte[0], pool.executeCommand("upper", null));
        }
    }

    @Test
    void shouldFailWithRetryableError() {
        SimulatedBackend backend = fastBackend();
        ResourceHandle handle = backend.initialize(AffinityPoolConfig.defaultConfig());

        CommandExecutionException e = assertThrows(CommandExecutionException.class,
                () -> handle.execute("fail", "order-1"));

        assertTrue(e.isRetryable());
        assertTrue(e.getMessage().contains("order-1"));
        handle.release();
    }

    @Test
    void shouldRejectUnknownOperation() {
        SimulatedBackend backend = fastBackend();
        ResourceHandle handle = backend.initialize(AffinityPoolConfig.defaultConfig());

        CommandExecutionException e = assertThrows(CommandExecutionException.class,
                () -> handle.execute("drop", ""));

        assertFalse(e.isRetryable());
        handle.release();
    }

    @Test
    void shouldSimulateFailures() {
        SimulatedBackend backend = SimulatedBackend.builder()
                .latency(0, 1)
                .failureRate(1.0)
                .build();
        ResourceHandle handle = backend.initialize(AffinityPoolConfig.defaultConfig());

        assertThrows(CommandExecutionException.class, () -> handle.execute("echo", "will-fail"));
        handle.release();
    }

    @Test
    void shouldSimulateLatency() {
        SimulatedBackend backend = SimulatedBackend.builder()
                .latency(50, 60)
                .build();
        ResourceHandle handle = backend.initialize(AffinityPoolConfig.defaultConfig());

        long start = System.currentTimeMillis();
        handle.execute("echo", "timed-request");
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(elapsed >= 50, "Expected at least 50ms but got " + elapsed);
        handle.release();
    }

    @Test
    void shouldRejectCallsFromAnotherThread() throws Exception {
        SimulatedBackend backend = fastBackend();
        ResourceHandle handle = backend.initialize(AffinityPoolConfig.defaultConfig());
        ExecutorService other = Executors.newSingleThreadExecutor();

        try {
            Future<Object> call = other.submit(() -> handle.execute("echo", "x"));
            ExecutionException e = assertThrows(ExecutionException.class, () -> call.get(2, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertTrue(e.getCause().getMessage().contains("bound to"));
        } finally {
            other.shutdown();
        }
        assertEquals(0, backend.getCommandCount());
        handle.release();
    }

    @Test
    void shouldReleaseSubResourcesOnce() {
        SimulatedBackend backend = fastBackend();
        ResourceHandle handle = backend.initialize(AffinityPoolConfig.defaultConfig());
        assertEquals(3, backend.getOpenSubResources());
        assertEquals(1, backend.getLiveHandles());

        handle.release();
        handle.release();

        assertEquals(0, backend.getOpenSubResources());
        assertEquals(0, backend.getLiveHandles());
        assertThrows(CommandExecutionException.class, () -> handle.execute("echo", "late"));
    }

    @Test
    void shouldUnwindCompletedStepsWhenInitializationFails() {
        SimulatedBackend backend = SimulatedBackend.builder()
                .failingStep(SimulatedBackend.STEP_HANDLER)
                .build();

        ResourceInitializationException e = assertThrows(ResourceInitializationException.class,
                () -> backend.initialize(AffinityPoolConfig.builder().entryPoint("Orders.Processor").build()));

        assertTrue(e.getMessage().contains("handler"));
        assertEquals(0, backend.getOpenSubResources());
        assertEquals(0, backend.getLiveHandles());
        assertEquals(1, backend.getHandleCount());
    }

    @Test
    void shouldServeThroughPoolOnWorkerThreads() {
        SimulatedBackend backend = fastBackend();

        try (AffinityPool pool = new AffinityPool(AffinityPoolConfig.builder()
                .connectionTarget("srv=test")
                .maxPoolSize(2)
                .build(), backend)) {
            byte[] result = pool.executeCommand("upper", "payload");
            assertEquals("PAYLOAD", new String(result, StandardCharsets.UTF_8));
        }

        assertEquals(0, backend.getLiveHandles());
        assertEquals(0, backend.getOpenSubResources());
    }

    @Test
    void shouldFailPoolConstructionWhenBackendCannotConnect() {
        SimulatedBackend backend = SimulatedBackend.builder()
                .failingStep(SimulatedBackend.STEP_CONNECT)
                .build();

        assertThrows(PoolConstructionException.class,
                () -> new AffinityPool(AffinityPoolConfig.defaultConfig(), backend));
        assertEquals(0, backend.getOpenSubResources());
    }

    @Test
    void shouldValidateBuilderArguments() {
        assertThrows(IllegalArgumentException.class, () -> SimulatedBackend.builder().latency(10, 5));
        assertThrows(IllegalArgumentException.class, () -> SimulatedBackend.builder().failureRate(1.5));
    }
}
