package hle.affinity.worker;

import hle.affinity.backend.HandleFunction;
import hle.affinity.backend.ResourceBackend;
import hle.affinity.backend.ResourceHandle;
import hle.affinity.backend.ResourceInitializationException;
import hle.affinity.pool.AffinityPoolConfig;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one backend resource and the dedicated thread that drives it.
 *
 * <p>The handle is created, used and released on a single platform thread for its
 * whole lifetime; no other thread ever sees it. Other threads talk to the worker only
 * through its command queue and its shutdown signal:
 * <ul>
 *   <li>{@link #start()} launches the thread, which initializes the handle;
 *       {@link #awaitReady()} blocks until that succeeded or failed</li>
 *   <li>{@link #call(HandleFunction)} queues a command and blocks for its result;
 *       commands run one at a time, in queue order</li>
 *   <li>{@link #shutdown()} stops the worker after the command in flight; commands
 *       still queued are not run and complete with {@link WorkerUnavailableException}</li>
 * </ul>
 *
 * <p>A command that throws an {@link Error} stops the worker: {@link #isStopping()} is
 * true before the error reaches the caller, and the handle is released as on shutdown.
 *
 * <p>The queue is bounded by {@link AffinityPoolConfig#getCommandQueueCapacity()}. A
 * submitter facing a full queue waits at most
 * {@link AffinityPoolConfig#getCommandSubmitTimeout()}; waiting for the result itself
 * has no timeout.
 *
 * <p>A worker that does not exit within the grace period of
 * {@link #awaitTermination(Duration)} is abandoned, not killed: a backend call that
 * never returns keeps its thread (a daemon) alive.
 */
public final class ResourceWorker {

    private static final Command<Void> STOP = new Command<>(-1, handle -> null);

    private final int id;
    private final ResourceBackend backend;
    private final AffinityPoolConfig config;
    private final Logger logger;
    private final Thread thread;

    private final BlockingQueue<Command<?>> commands = new LinkedBlockingQueue<>();
    private final Semaphore queueSlots;
    private final ReentrantLock submitLock = new ReentrantLock();
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean stopping;

    /**
     * Creates a worker; nothing runs until {@link #start()}.
     *
     * @param id the identity of the resource this worker owns
     * @param backend creates the handle on the worker thread
     * @param config normalized pool configuration
     * @param logger the pool's logger
     */
    public ResourceWorker(int id, ResourceBackend backend, AffinityPoolConfig config, Logger logger) {
        this.id = id;
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.queueSlots = new Semaphore(config.getCommandQueueCapacity());
        this.thread = new Thread(this::run, "affinity-worker-" + id);
        // abandoned workers must not keep the JVM alive
        this.thread.setDaemon(true);
    }

    /**
     * Starts the worker thread, which begins by initializing the backend resource.
     */
    public void start() {
        thread.start();
    }

    /**
     * Blocks until the worker finished initializing its resource.
     *
     * @throws ResourceInitializationException if the backend failed to initialize,
     *         or the caller was interrupted while waiting
     */
    public void awaitReady() throws ResourceInitializationException {
        try {
            ready.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw new ResourceInitializationException("Interrupted while initializing resource " + id, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResourceInitializationException) {
                throw (ResourceInitializationException) cause;
            }
            throw new ResourceInitializationException("Failed to initialize resource " + id, cause);
        }
    }

    /**
     * Runs a function against the handle on the worker thread and waits for its result.
     *
     * @throws WorkerUnavailableException if the command could not be queued or the
     *         worker stopped before running it
     * @throws hle.affinity.backend.CommandExecutionException if the function failed
     */
    public <T> T call(HandleFunction<T> function) {
        Objects.requireNonNull(function, "function cannot be null");
        return submit(function).await();
    }

    /**
     * Executes an opaque command against the handle and waits for the payload.
     */
    public Object execute(String operation, String params) {
        Objects.requireNonNull(operation, "operation cannot be null");
        return call(handle -> handle.execute(operation, params));
    }

    private <T> Command<T> submit(HandleFunction<T> function) {
        if (stopping) {
            throw stoppedError();
        }
        Duration submitTimeout = config.getCommandSubmitTimeout();
        boolean queued;
        try {
            queued = queueSlots.tryAcquire(submitTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerUnavailableException("Interrupted while queueing a command for resource " + id, e);
        }
        if (!queued) {
            throw new WorkerUnavailableException(String.format(
                    "Command queue of resource %d stayed full for %dms", id, submitTimeout.toMillis()));
        }

        Command<T> command = new Command<>(id, function);
        submitLock.lock();
        try {
            if (stopping) {
                queueSlots.release();
                throw stoppedError();
            }
            commands.add(command);
        } finally {
            submitLock.unlock();
        }
        return command;
    }

    /**
     * Signals the worker to stop. Idempotent and non-blocking; use
     * {@link #awaitTermination(Duration)} to wait for the thread to exit.
     */
    public void shutdown() {
        submitLock.lock();
        try {
            if (stopping) {
                return;
            }
            stopping = true;
            commands.add(STOP);
        } finally {
            submitLock.unlock();
        }
    }

    /**
     * Waits for the worker thread to release its resource and exit.
     *
     * @return true if the worker exited, false if the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void run() {
        ResourceHandle handle;
        try {
            logger.debug("Initializing resource {} with entry point {}", id, config.getEntryPoint());
            handle = backend.initialize(config);
            if (handle == null) {
                throw new ResourceInitializationException("Backend returned no handle for resource " + id);
            }
        } catch (RuntimeException e) {
            markStopped();
            ready.completeExceptionally(e);
            terminated.countDown();
            return;
        } catch (Error e) {
            markStopped();
            ready.completeExceptionally(e);
            terminated.countDown();
            throw e;
        }

        logger.debug("Resource {} initialized on {}", id, thread.getName());
        ready.complete(null);
        try {
            processCommands(handle);
        } finally {
            markStopped();
            rejectPending();
            releaseHandle(handle);
            terminated.countDown();
        }
    }

    private void processCommands(ResourceHandle handle) {
        while (true) {
            Command<?> command;
            try {
                command = commands.take();
            } catch (InterruptedException e) {
                logger.warn("Worker of resource {} interrupted, stopping", id);
                Thread.currentThread().interrupt();
                return;
            }
            if (command == STOP) {
                logger.debug("Worker of resource {} shutting down", id);
                return;
            }
            queueSlots.release();
            if (stopping) {
                command.fail(stoppedError());
                return;
            }
            try {
                command.run(handle);
            } catch (Error e) {
                // the handle is in an unknown state; stop before the caller sees the error
                markStopped();
                logger.error("Worker of resource {} stopping after a fatal error", id, e);
                command.fail(e);
                return;
            }
        }
    }

    private void markStopped() {
        submitLock.lock();
        try {
            stopping = true;
        } finally {
            submitLock.unlock();
        }
    }

    private void rejectPending() {
        List<Command<?>> pending = new ArrayList<>();
        commands.drainTo(pending);
        int rejected = 0;
        for (Command<?> command : pending) {
            if (command != STOP && !command.isDone()) {
                command.fail(stoppedError());
                rejected++;
            }
        }
        if (rejected > 0) {
            logger.debug("Resource {} rejected {} queued commands on shutdown", id, rejected);
        }
    }

    private void releaseHandle(ResourceHandle handle) {
        try {
            handle.release();
        } catch (RuntimeException e) {
            logger.warn("Failed to release resource {}: {}", id, e.getMessage());
        }
    }

    private WorkerUnavailableException stoppedError() {
        return new WorkerUnavailableException("Worker of resource " + id + " is stopped");
    }

    public int getId() {
        return id;
    }

    /**
     * Returns the name of the thread that owns the resource.
     */
    public String getThreadName() {
        return thread.getName();
    }

    /**
     * Returns the number of commands waiting to run.
     */
    public int getQueuedCommands() {
        return config.getCommandQueueCapacity() - queueSlots.availablePermits();
    }

    /**
     * Returns true once shutdown was requested or the worker failed.
     */
    public boolean isStopping() {
        return stopping;
    }

    /**
     * Returns true when the worker thread has exited.
     */
    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }
}
