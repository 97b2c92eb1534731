package hle.affinity.pool;

import hle.affinity.backend.HandleFunction;
import hle.affinity.backend.ResourceBackend;
import hle.affinity.backend.ResourceInitializationException;
import hle.affinity.worker.ResourceWorker;
import org.apache.commons.pool2.impl.DefaultEvictionPolicy;
import org.apache.commons.pool2.impl.EvictionConfig;
import org.apache.commons.pool2.impl.EvictionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A thread-safe pool of thread-affine resources.
 *
 * <p>Every resource is created, used and released by its own {@link ResourceWorker}
 * thread. Callers never touch a resource directly: they acquire a
 * {@link ResourceRecord}, run commands through it (which queues them on the worker
 * thread) and release it again.
 *
 * <p>Key features:
 * <ul>
 *   <li>{@code minPoolSize} resources created up front, growth on demand up to {@code maxPoolSize}</li>
 *   <li>Acquire waits {@code waitConnTimeout} for a free resource before growing the pool</li>
 *   <li>Idle resources above the minimum are evicted by a background reaper</li>
 *   <li>Idempotent close that wakes waiting callers and stops every worker</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * try (AffinityPool pool = new AffinityPool(
 *         AffinityPoolConfig.builder()
 *             .connectionTarget("srv=primary;db=orders")
 *             .minPoolSize(1)
 *             .maxPoolSize(4)
 *             .build(),
 *         config -> MyBackend.connect(config))) {
 *
 *     byte[] result = pool.executeCommand("GetOrder", "{\"id\":42}");
 * }
 * }</pre>
 */
public final class AffinityPool implements AutoCloseable {

    private static final ResourceRecord SHUTDOWN_MARKER = new ResourceRecord(-1, null);

    private final AffinityPoolConfig config;
    private final ResourceBackend backend;
    private final Logger logger;

    private final List<ResourceRecord> records = new ArrayList<>();
    private final ReentrantReadWriteLock poolLock = new ReentrantReadWriteLock();
    private final ReentrantLock createLock = new ReentrantLock();
    private final BlockingQueue<ResourceRecord> freeRegistry;
    private final AtomicInteger nextId = new AtomicInteger(0);

    private final EvictionPolicy<ResourceWorker> evictionPolicy = new DefaultEvictionPolicy<>();
    private final EvictionConfig evictionConfig;
    private final IdleReaper reaper;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closeDone = new CountDownLatch(1);

    /**
     * Creates a pool that logs through the {@code AffinityPool} class logger.
     *
     * @see #AffinityPool(AffinityPoolConfig, ResourceBackend, Logger)
     */
    public AffinityPool(AffinityPoolConfig config, ResourceBackend backend) {
        this(config, backend, LoggerFactory.getLogger(AffinityPool.class));
    }

    /**
     * Creates the pool, its minimum set of resources and the idle reaper.
     *
     * @param config pool configuration, normalized before use
     * @param backend creates and initializes resources on their worker threads
     * @param logger logger used by the pool and its workers
     * @throws PoolConstructionException if any initial resource fails to initialize;
     *         resources created before the failure are torn down first
     */
    public AffinityPool(AffinityPoolConfig config, ResourceBackend backend, Logger logger) {
        this.config = Objects.requireNonNull(config, "config cannot be null").normalize();
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.freeRegistry = new ArrayBlockingQueue<>(this.config.getMaxPoolSize());
        // soft eviction only: idle longer than idleTimeout while more than minPoolSize are alive
        this.evictionConfig = new EvictionConfig(
                Duration.ofMillis(Long.MAX_VALUE), this.config.getIdleTimeout(), this.config.getMinPoolSize());
        this.reaper = new IdleReaper(this, this.config.getCleanupInterval(), logger);

        logger.info("Starting {}", this.config);
        try {
            for (int i = 0; i < this.config.getMinPoolSize(); i++) {
                createResource();
            }
        } catch (RuntimeException e) {
            close();
            throw new PoolConstructionException("Failed to create initial resources", e);
        }
        reaper.start();
    }

    /**
     * Takes a free resource, growing the pool if none frees up in time.
     *
     * <p>Steps: take a free resource immediately if there is one; otherwise wait up to
     * {@code waitConnTimeout}; if that times out and the pool is below its maximum,
     * create one resource and wait once more. The returned record is busy until it is
     * passed to {@link #release(ResourceRecord)}.
     *
     * @return an acquired record
     * @throws AcquireTimeoutException if no resource became free and the pool is at its maximum
     * @throws PoolShutdownException if the pool is closed, or closes while waiting
     * @throws ResourcePoolException if growing the pool failed
     */
    public ResourceRecord acquire() {
        ensureOpen();
        Duration wait = config.getWaitConnTimeout();

        ResourceRecord record = takeFree(Duration.ZERO);
        if (record == null) {
            record = takeFree(wait);
        }
        if (record == null) {
            if (activeCount() >= config.getMaxPoolSize()) {
                throw new AcquireTimeoutException(wait);
            }
            try {
                createResource();
            } catch (ResourceInitializationException e) {
                throw new ResourcePoolException("Failed to create new resource", e);
            }
            record = takeFree(wait);
            if (record == null) {
                throw new AcquireTimeoutException(wait.multipliedBy(2));
            }
        }
        logger.debug("Acquired resource {}", record.getId());
        return record;
    }

    private ResourceRecord takeFree(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            ResourceRecord record;
            try {
                long remaining = deadline - System.nanoTime();
                record = remaining > 0
                        ? freeRegistry.poll(remaining, TimeUnit.NANOSECONDS)
                        : freeRegistry.poll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ResourcePoolException("Interrupted while waiting for a free resource", e);
            }
            if (record == null) {
                return null;
            }
            if (record == SHUTDOWN_MARKER) {
                // leave the marker for the next waiter
                freeRegistry.offer(SHUTDOWN_MARKER);
                throw new PoolShutdownException();
            }
            if (record.worker().isStopping()) {
                logger.warn("Discarding resource {} whose worker has stopped", record.getId());
                closeResource(record);
                continue;
            }
            if (record.markAcquired()) {
                return record;
            }
            logger.debug("Skipping resource {} that is no longer idle", record.getId());
        }
    }

    /**
     * Returns an acquired record to the pool. If the free registry has no room, or the
     * record's worker has stopped, the resource is torn down instead.
     */
    public void release(ResourceRecord record) {
        Objects.requireNonNull(record, "record cannot be null");
        if (!record.markReleased()) {
            if (record.isInvalid()) {
                logger.debug("Resource {} was closed while in use", record.getId());
            } else {
                logger.warn("Resource {} released while not acquired", record.getId());
            }
            return;
        }
        if (closed.get()) {
            logger.debug("Pool closed, not returning resource {}", record.getId());
            return;
        }
        if (record.worker().isStopping()) {
            logger.warn("Worker of resource {} has stopped, removing it from the pool", record.getId());
            closeResource(record);
            return;
        }
        if (freeRegistry.offer(record)) {
            logger.debug("Released resource {} back to pool", record.getId());
        } else {
            logger.debug("Free registry full, closing resource {}", record.getId());
            closeResource(record);
        }
    }

    /**
     * Runs a function against a pooled resource's handle, on that resource's worker thread.
     * The resource is released whether the function succeeds or fails.
     */
    public <T> T execute(HandleFunction<T> function) {
        Objects.requireNonNull(function, "function cannot be null");
        ResourceRecord record = acquire();
        try {
            return record.call(function);
        } finally {
            release(record);
        }
    }

    /**
     * Executes an opaque command on any pooled resource and returns the result bytes.
     *
     * @throws hle.affinity.backend.CommandExecutionException if the backend reported a failure
     * @throws ResultShapeException if the backend's payload cannot be converted to bytes
     */
    public byte[] executeCommand(String operation, String params) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Object payload = execute(handle -> handle.execute(operation, params));
        return toResultBytes(operation, payload);
    }

    static byte[] toResultBytes(String operation, Object payload) {
        if (payload instanceof byte[]) {
            return (byte[]) payload;
        }
        if (payload instanceof CharSequence || payload instanceof Number
                || payload instanceof Boolean || payload instanceof Character) {
            return payload.toString().getBytes(StandardCharsets.UTF_8);
        }
        String shape = payload == null ? "null" : payload.getClass().getName();
        throw new ResultShapeException("Result of " + operation + " can not be converted to bytes: " + shape);
    }

    /**
     * Evicts idle resources above the minimum pool size.
     *
     * @return the number of resources evicted
     */
    int evictIdle() {
        if (closed.get()) {
            return 0;
        }
        List<ResourceRecord> candidates;
        poolLock.readLock().lock();
        try {
            if (records.size() <= config.getMinPoolSize()) {
                return 0;
            }
            candidates = new ArrayList<>(records);
        } finally {
            poolLock.readLock().unlock();
        }

        int evicted = 0;
        for (ResourceRecord record : candidates) {
            int active = activeCount();
            if (active <= config.getMinPoolSize()) {
                break;
            }
            if (record.isBusy() || !evictionPolicy.evict(evictionConfig, record.pooledObject(), active)) {
                continue;
            }
            // a concurrent acquire may have taken it since the check
            if (!freeRegistry.remove(record)) {
                continue;
            }
            logger.debug("Evicting resource {}, idle for {}ms", record.getId(), record.getIdleDuration().toMillis());
            closeResource(record);
            evicted++;
        }
        return evicted;
    }

    BlockingQueue<ResourceRecord> freeRegistry() {
        return freeRegistry;
    }

    private void createResource() throws ResourceInitializationException {
        createLock.lock();
        try {
            ensureOpen();
            if (activeCount() >= config.getMaxPoolSize()) {
                return;
            }
            int id = nextId.incrementAndGet();
            ResourceWorker worker = new ResourceWorker(id, backend, config, logger);
            worker.start();
            try {
                worker.awaitReady();
            } catch (ResourceInitializationException e) {
                logger.error("Failed to initialize resource {}: {}", id, e.getMessage());
                throw e;
            }

            ResourceRecord record = new ResourceRecord(id, worker);
            boolean added = false;
            int active;
            poolLock.writeLock().lock();
            try {
                // close() snapshots the records under this lock after setting the flag
                if (!closed.get()) {
                    added = records.add(record);
                }
                active = records.size();
            } finally {
                poolLock.writeLock().unlock();
            }
            if (!added) {
                stopResource(record);
                throw new PoolShutdownException();
            }
            freeRegistry.offer(record);
            logger.info("Created resource {}, total active: {}", id, active);
        } finally {
            createLock.unlock();
        }
    }

    private void closeResource(ResourceRecord record) {
        stopResource(record);
        awaitResource(record);
    }

    private void stopResource(ResourceRecord record) {
        record.invalidate();
        record.worker().shutdown();
    }

    private void awaitResource(ResourceRecord record) {
        Duration grace = config.getWorkerShutdownTimeout();
        try {
            if (!record.worker().awaitTermination(grace)) {
                logger.warn("Resource {} worker shutdown timeout after {}ms, abandoning it",
                        record.getId(), grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for resource {} worker to stop", record.getId());
        }

        boolean removed;
        int remaining;
        poolLock.writeLock().lock();
        try {
            removed = records.remove(record);
            remaining = records.size();
        } finally {
            poolLock.writeLock().unlock();
        }
        if (removed) {
            logger.info("Closed resource {}, remaining: {}", record.getId(), remaining);
        }
    }

    /**
     * Returns a snapshot of every live resource and the pool counters.
     * Never waits on a worker thread.
     */
    public PoolStatus status() {
        List<ResourceStats> stats = new ArrayList<>();
        int active;
        poolLock.readLock().lock();
        try {
            for (ResourceRecord record : records) {
                stats.add(ResourceStats.of(record));
            }
            active = records.size();
        } finally {
            poolLock.readLock().unlock();
        }
        stats.sort(Comparator.comparingInt(ResourceStats::getId));
        int idle = (int) freeRegistry.stream().filter(record -> record != SHUTDOWN_MARKER).count();
        return new PoolStatus(stats, active, idle, config.getMaxPoolSize(), closed.get());
    }

    /**
     * Gets the number of live resources (busy and idle).
     */
    public int activeCount() {
        poolLock.readLock().lock();
        try {
            return records.size();
        } finally {
            poolLock.readLock().unlock();
        }
    }

    /**
     * Gets the normalized configuration in effect.
     */
    public AffinityPoolConfig getConfig() {
        return config;
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new PoolShutdownException();
        }
    }

    /**
     * Shuts the pool down: stops the reaper, fails waiting and future acquires with
     * {@link PoolShutdownException}, stops every worker and waits for each up to
     * {@code workerShutdownTimeout}. Workers that do not stop in time are logged and
     * dropped. Only the first call does the work; concurrent callers wait for it.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            awaitClosed();
            return;
        }
        try {
            logger.info("Closing affinity pool, active: {}", activeCount());
            reaper.close();
            freeRegistry.clear();
            while (!freeRegistry.offer(SHUTDOWN_MARKER)) {
                freeRegistry.clear();
            }

            List<ResourceRecord> snapshot;
            poolLock.writeLock().lock();
            try {
                snapshot = new ArrayList<>(records);
            } finally {
                poolLock.writeLock().unlock();
            }
            for (ResourceRecord record : snapshot) {
                stopResource(record);
            }
            for (ResourceRecord record : snapshot) {
                awaitResource(record);
            }

            poolLock.writeLock().lock();
            try {
                records.clear();
            } finally {
                poolLock.writeLock().unlock();
            }
            logger.info("Affinity pool closed");
        } finally {
            closeDone.countDown();
        }
    }

    private void awaitClosed() {
        try {
            closeDone.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
