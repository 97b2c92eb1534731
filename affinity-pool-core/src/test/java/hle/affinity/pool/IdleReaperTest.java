package hle.affinity.pool;

import hle.affinity.backend.InstrumentedBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for idle eviction.
 */
class IdleReaperTest {

    private AffinityPool pool;
    private InstrumentedBackend backend;

    @BeforeEach
    void setUp() {
        backend = new InstrumentedBackend();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private List<ResourceRecord> acquireAll(int count) {
        List<ResourceRecord> held = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            held.add(pool.acquire());
        }
        return held;
    }

    @Test
    @Timeout(10)
    void shouldShrinkBackToMinimumWhenIdle() throws InterruptedException {
        pool = new AffinityPool(AffinityPoolConfig.builder()
                .minPoolSize(0)
                .maxPoolSize(3)
                .idleTimeout(Duration.ofMillis(10))
                .cleanupInterval(Duration.ofMillis(5))
                .waitConnTimeout(Duration.ofMillis(10))
                .build(), backend);

        List<ResourceRecord> held = acquireAll(3);
        assertEquals(3, pool.activeCount());
        held.forEach(pool::release);

        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.activeCount() == 1);
        Thread.sleep(100);

        assertEquals(1, pool.activeCount());
        assertEquals(2, backend.getReleaseCount());
        assertEquals(1, pool.status().getIdleCount());
        assertEquals(0, backend.getAffinityViolations());
    }

    @Test
    @Timeout(10)
    void shouldNotEvictBusyResources() throws InterruptedException {
        pool = new AffinityPool(AffinityPoolConfig.builder()
                .minPoolSize(1)
                .maxPoolSize(2)
                .idleTimeout(Duration.ofMillis(10))
                .cleanupInterval(Duration.ofMillis(5))
                .waitConnTimeout(Duration.ofMillis(10))
                .build(), backend);

        List<ResourceRecord> held = acquireAll(2);
        Thread.sleep(150);

        assertEquals(2, pool.activeCount());
        assertEquals(0, backend.getReleaseCount());
        for (ResourceRecord record : held) {
            assertEquals("still here", record.execute("echo", "still here"));
            pool.release(record);
        }

        await().atMost(2, TimeUnit.SECONDS).until(() -> pool.activeCount() == 1);
    }

    @Test
    @Timeout(10)
    void shouldKeepMinimumEvenWhenAllIdle() throws InterruptedException {
        pool = new AffinityPool(AffinityPoolConfig.builder()
                .minPoolSize(2)
                .maxPoolSize(4)
                .idleTimeout(Duration.ofMillis(10))
                .cleanupInterval(Duration.ofMillis(5))
                .build(), backend);

        Thread.sleep(150);

        assertEquals(2, pool.activeCount());
        assertEquals(0, backend.getReleaseCount());
    }

    @Test
    void shouldEvictOnlyResourcesIdleLongerThanTimeout() {
        pool = new AffinityPool(AffinityPoolConfig.builder()
                .minPoolSize(1)
                .maxPoolSize(3)
                .idleTimeout(Duration.ofMinutes(5))
                .cleanupInterval(Duration.ofMinutes(5))
                .waitConnTimeout(Duration.ofMillis(10))
                .build(), backend);

        acquireAll(3).forEach(pool::release);

        assertEquals(0, pool.evictIdle());
        assertEquals(3, pool.activeCount());
    }

    @Test
    void shouldDoNothingAfterClose() {
        pool = new AffinityPool(AffinityPoolConfig.builder()
                .minPoolSize(1)
                .maxPoolSize(2)
                .build(), backend);

        pool.close();

        assertEquals(0, pool.evictIdle());
    }
}
