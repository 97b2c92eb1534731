package hle.affinity.pool;

import hle.affinity.backend.HandleFunction;
import hle.affinity.worker.ResourceWorker;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.PooledObjectState;
import org.apache.commons.pool2.impl.DefaultPooledObject;

import java.time.Duration;
import java.time.Instant;

/**
 * Pool-side view of one live resource: its identity, usage bookkeeping and worker.
 *
 * <p>Busy flag, last-used instant and use count are tracked by a commons-pool2
 * {@link DefaultPooledObject}, whose state transitions are synchronized. Readers such
 * as {@link AffinityPool#status()} never wait on the worker thread, which does not
 * touch this state.
 *
 * <p>Callers obtain records from {@link AffinityPool#acquire()} and must hand them
 * back with {@link AffinityPool#release(ResourceRecord)}.
 */
public final class ResourceRecord {

    private final int id;
    private final ResourceWorker worker;
    private final DefaultPooledObject<ResourceWorker> state;

    ResourceRecord(int id, ResourceWorker worker) {
        this.id = id;
        this.worker = worker;
        this.state = new DefaultPooledObject<>(worker);
    }

    public int getId() {
        return id;
    }

    /**
     * Executes an opaque command on this resource's worker thread.
     */
    public Object execute(String operation, String params) {
        return worker.execute(operation, params);
    }

    /**
     * Runs a function against this resource's handle on its worker thread.
     */
    public <T> T call(HandleFunction<T> function) {
        return worker.call(function);
    }

    public boolean isBusy() {
        return state.getState() == PooledObjectState.ALLOCATED;
    }

    /**
     * Returns the latest of creation, acquisition and release.
     */
    public Instant getLastUsed() {
        Instant borrowed = state.getLastUsedInstant();
        Instant returned = state.getLastReturnInstant();
        return returned.isAfter(borrowed) ? returned : borrowed;
    }

    /**
     * Returns how many times this resource has been acquired.
     */
    public long getUseCount() {
        return state.getBorrowedCount();
    }

    /**
     * Returns how long the resource has been idle, zero while busy.
     */
    public Duration getIdleDuration() {
        return isBusy() ? Duration.ZERO : state.getIdleDuration();
    }

    ResourceWorker worker() {
        return worker;
    }

    PooledObject<ResourceWorker> pooledObject() {
        return state;
    }

    /**
     * Marks the record busy, stamps last-used and counts the use.
     *
     * @return false if the record is not idle (already acquired or invalidated)
     */
    boolean markAcquired() {
        return state.allocate();
    }

    /**
     * Clears the busy flag and stamps last-used.
     *
     * @return false if the record was not busy
     */
    boolean markReleased() {
        return state.deallocate();
    }

    /**
     * Marks the record as torn down; it can never be acquired again.
     */
    void invalidate() {
        state.invalidate();
    }

    boolean isInvalid() {
        return state.getState() == PooledObjectState.INVALID;
    }

    @Override
    public String toString() {
        return String.format("ResourceRecord[id=%d, state=%s, useCount=%d]", id, state.getState(), getUseCount());
    }
}
