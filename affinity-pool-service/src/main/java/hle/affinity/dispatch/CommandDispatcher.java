package hle.affinity.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import hle.affinity.pool.AffinityPool;
import hle.affinity.pool.PoolStatus;
import hle.affinity.pool.ResourceStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Asynchronous front end that feeds commands into an {@link AffinityPool}.
 *
 * <p>A fixed set of dispatcher threads takes commands from a bounded queue and runs
 * each through {@link AffinityPool#executeCommand(String, String)}. When the queue is
 * full the configured {@link DispatcherConfig.RejectionPolicy} applies. Every submit
 * returns a future that always completes normally with a {@link CommandResult}; failures
 * are reported inside the result.
 *
 * <p>Two operations are answered by the dispatcher itself without acquiring a resource:
 * {@value #HEALTH} returns {@code OK} and {@value #STATUS} returns the pool status as JSON.
 *
 * <p>The dispatcher owns the pool: {@link #close()} drains queued commands for at most
 * {@link DispatcherConfig#getDrainTimeout()} and then closes the pool.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (CommandDispatcher dispatcher = new CommandDispatcher(pool, DispatcherConfig.defaultConfig())) {
 *     CompletableFuture<CommandResult<byte[]>> future =
 *             dispatcher.submit("req-1", "GetOrder", "{\"id\":42}");
 *     CommandResult<byte[]> result = future.join();
 * }
 * }</pre>
 */
public class CommandDispatcher implements AutoCloseable {

    public static final String HEALTH = "health";
    public static final String STATUS = "status";

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);
    private static final byte[] HEALTHY = "OK".getBytes(StandardCharsets.UTF_8);

    private final AffinityPool pool;
    private final DispatcherConfig config;
    private final ThreadPoolExecutor workerPool;
    private final BlockingQueue<Runnable> workQueue;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final AtomicLong submittedCount = new AtomicLong(0);
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicInteger activeCount = new AtomicInteger(0);

    public CommandDispatcher(AffinityPool pool, DispatcherConfig config) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.workQueue = new LinkedBlockingQueue<>(config.getQueueCapacity());

        this.workerPool = new ThreadPoolExecutor(
                config.getConcurrency(),
                config.getConcurrency(),
                60L, TimeUnit.SECONDS,
                workQueue,
                dispatcherThreads(config),
                createRejectionHandler());
        logger.info("Command dispatcher started: {}", config);
    }

    private static ThreadFactory dispatcherThreads(DispatcherConfig config) {
        AtomicInteger sequence = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, config.getThreadNamePrefix() + "-" + sequence.incrementAndGet());
            thread.setDaemon(config.isDaemon());
            return thread;
        };
    }

    private RejectedExecutionHandler createRejectionHandler() {
        switch (config.getRejectionPolicy()) {
            case BLOCK:
                return (r, executor) -> {
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("Dispatcher is shut down");
                    }
                    try {
                        executor.getQueue().put(r);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while waiting for queue space", e);
                    }
                };
            case CALLER_RUNS:
                return (r, executor) -> {
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("Dispatcher is shut down");
                    }
                    r.run();
                };
            case REJECT:
            default:
                return new ThreadPoolExecutor.AbortPolicy();
        }
    }

    /**
     * Queues a command for execution on any pooled resource.
     *
     * @param commandId identifier reported back in the result
     * @param operation the backend operation, or {@value #HEALTH} / {@value #STATUS}
     * @param params opaque parameters passed to the backend
     * @return a future completed with the result; never completed exceptionally
     */
    public CompletableFuture<CommandResult<byte[]>> submit(String commandId, String operation, String params) {
        Objects.requireNonNull(operation, "operation cannot be null");
        if (shutdown.get()) {
            return CompletableFuture.completedFuture(CommandResult.failure(commandId,
                    new RejectedExecutionException("Dispatcher is shut down"), Instant.now(), Instant.now()));
        }

        submittedCount.incrementAndGet();
        CompletableFuture<CommandResult<byte[]>> future = new CompletableFuture<>();

        DispatchTask task = new DispatchTask(commandId, operation, params, future);
        try {
            workerPool.execute(task);
        } catch (RejectedExecutionException e) {
            logger.warn("Command {} rejected: {}", commandId, e.getMessage());
            task.fail(e);
        }
        return future;
    }

    private byte[] dispatch(String operation, String params) {
        switch (operation) {
            case HEALTH:
                return HEALTHY.clone();
            case STATUS:
                return statusJson(pool.status());
            default:
                return pool.executeCommand(operation, params);
        }
    }

    private byte[] statusJson(PoolStatus status) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("active", status.getActiveCount());
        root.put("idle", status.getIdleCount());
        root.put("max", status.getMaxPoolSize());
        root.put("closed", status.isClosed());
        ArrayNode resources = root.putArray("resources");
        for (ResourceStats stats : status.getResources()) {
            resources.addObject()
                    .put("id", stats.getId())
                    .put("useCount", stats.getUseCount())
                    .put("lastUsed", stats.getLastUsed().toString())
                    .put("busy", stats.isBusy());
        }
        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pool status", e);
        }
    }

    /**
     * Waits until every command has a result and returns the results in submission order.
     * Futures returned by {@link #submit} always complete normally, whatever the command's
     * outcome.
     */
    public List<CommandResult<byte[]>> awaitAll(List<CompletableFuture<CommandResult<byte[]>>> futures) {
        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    /**
     * Like {@link #awaitAll(List)}, but gives up after {@code timeout}.
     *
     * @throws TimeoutException if some command has no result yet when the timeout elapses
     */
    public List<CommandResult<byte[]>> awaitAll(List<CompletableFuture<CommandResult<byte[]>>> futures,
                                                Duration timeout) throws TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (CompletableFuture<CommandResult<byte[]>> future : futures) {
            try {
                future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for command results", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Command future completed exceptionally", e.getCause());
            }
        }
        return awaitAll(futures);
    }

    public AffinityPool getPool() {
        return pool;
    }

    /**
     * Gets the number of commands currently running against the pool.
     */
    public int getActiveCount() {
        return activeCount.get();
    }

    /**
     * Gets the number of commands waiting for a dispatcher thread.
     */
    public int getQueueSize() {
        return workQueue.size();
    }

    public long getSubmittedCount() {
        return submittedCount.get();
    }

    public long getCompletedCount() {
        return completedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }

    /**
     * One-line summary of the counters, for logs.
     */
    public String getStats() {
        return config.getThreadNamePrefix()
                + ": submitted=" + submittedCount.get()
                + " completed=" + completedCount.get()
                + " failed=" + failedCount.get()
                + " running=" + activeCount.get() + "/" + config.getConcurrency()
                + " queued=" + getQueueSize() + "/" + config.getQueueCapacity();
    }

    private int cancelQueued() {
        List<Runnable> dropped = workerPool.shutdownNow();
        for (Runnable runnable : dropped) {
            if (runnable instanceof DispatchTask) {
                ((DispatchTask) runnable).fail(new RejectedExecutionException("Dispatcher closed before the command ran"));
            }
        }
        return dropped.size();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Stops accepting commands, waits for queued ones up to the drain timeout, cancels
     * whatever is left and closes the pool.
     */
    @Override
    public void close() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(config.getDrainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                int dropped = cancelQueued();
                logger.warn("Dispatcher drain timed out after {}ms, {} queued commands dropped",
                        config.getDrainTimeout().toMillis(), dropped);
            }
        } catch (InterruptedException e) {
            cancelQueued();
            Thread.currentThread().interrupt();
        }
        logger.info("Command dispatcher stopped: {}", getStats());
        pool.close();
    }

    private final class DispatchTask implements Runnable {
        private final String commandId;
        private final String operation;
        private final String params;
        private final CompletableFuture<CommandResult<byte[]>> future;

        DispatchTask(String commandId, String operation, String params,
                     CompletableFuture<CommandResult<byte[]>> future) {
            this.commandId = commandId;
            this.operation = operation;
            this.params = params;
            this.future = future;
        }

        // counters settle before the future completes
        @Override
        public void run() {
            Instant startTime = Instant.now();
            activeCount.incrementAndGet();
            try {
                byte[] result = dispatch(operation, params);
                activeCount.decrementAndGet();
                completedCount.incrementAndGet();
                future.complete(CommandResult.success(commandId, result, startTime, Instant.now()));
            } catch (RuntimeException e) {
                settleFailure(e, startTime);
                logger.debug("Command {} ({}) failed: {}", commandId, operation, e.getMessage());
            } catch (Error e) {
                settleFailure(e, startTime);
                logger.error("Command {} ({}) failed fatally", commandId, operation, e);
            }
        }

        private void settleFailure(Throwable e, Instant startTime) {
            activeCount.decrementAndGet();
            failedCount.incrementAndGet();
            future.complete(CommandResult.failure(commandId, e, startTime, Instant.now()));
        }

        void fail(RuntimeException e) {
            if (!future.isDone()) {
                failedCount.incrementAndGet();
                future.complete(CommandResult.failure(commandId, e, Instant.now(), Instant.now()));
            }
        }
    }
}
