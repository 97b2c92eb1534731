package hle.affinity.pool;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background task that periodically asks the pool to evict resources that stayed
 * idle longer than the idle timeout. The pool decides what to evict and never goes
 * below its minimum size.
 */
final class IdleReaper implements AutoCloseable {

    private static final AtomicInteger REAPER_COUNT = new AtomicInteger(0);

    private final AffinityPool pool;
    private final Duration interval;
    private final Logger logger;
    private final ScheduledExecutorService scheduler;

    IdleReaper(AffinityPool pool, Duration interval, Logger logger) {
        this.pool = pool;
        this.interval = interval;
        this.logger = logger;

        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("affinity-pool-reaper-" + REAPER_COUNT.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
    }

    void start() {
        long periodNanos = interval.toNanos();
        scheduler.scheduleWithFixedDelay(this::sweep, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
        logger.debug("Idle reaper started, interval {}ms", interval.toMillis());
    }

    private void sweep() {
        // an exception escaping here would cancel all future runs
        try {
            int evicted = pool.evictIdle();
            if (evicted > 0) {
                logger.debug("Idle reaper evicted {} resources, active: {}", evicted, pool.activeCount());
            }
        } catch (RuntimeException e) {
            logger.error("Idle resource sweep failed", e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
