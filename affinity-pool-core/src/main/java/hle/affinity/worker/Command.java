package hle.affinity.worker;

import hle.affinity.backend.CommandExecutionException;
import hle.affinity.backend.HandleFunction;
import hle.affinity.backend.ResourceHandle;
import hle.affinity.pool.ResourcePoolException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * A unit of work queued on one worker, paired with its single-use result.
 * The result is completed exactly once: by {@link #run(ResourceHandle)} on the
 * worker thread, or by {@link #fail(Throwable)} when the worker stops first or the
 * function threw an {@link Error}.
 *
 * @param <T> the result type
 */
final class Command<T> {

    private final int workerId;
    private final HandleFunction<T> function;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    Command(int workerId, HandleFunction<T> function) {
        this.workerId = workerId;
        this.function = function;
    }

    /**
     * Runs the function and completes the result with its value or exception.
     * An {@link Error} is left to the caller, which must pass it to {@link #fail(Throwable)}.
     */
    void run(ResourceHandle handle) {
        try {
            result.complete(function.apply(handle));
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
    }

    void fail(Throwable reason) {
        result.completeExceptionally(reason);
    }

    boolean isDone() {
        return result.isDone();
    }

    /**
     * Blocks until the command has a result. There is no timeout: once a command
     * is queued it either runs or is rejected when its worker stops.
     */
    T await() {
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerUnavailableException(
                    "Interrupted while waiting for a result from resource " + workerId, e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    private RuntimeException unwrap(Throwable cause) {
        if (cause instanceof ResourcePoolException) {
            return (ResourcePoolException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new CommandExecutionException("Command failed on resource " + workerId + ": " + message, cause);
    }
}
