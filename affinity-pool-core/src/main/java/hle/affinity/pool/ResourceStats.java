package hle.affinity.pool;

import java.time.Instant;

/**
 * Usage statistics of one resource at the time a {@link PoolStatus} was taken.
 */
public final class ResourceStats {

    private final int id;
    private final long useCount;
    private final Instant lastUsed;
    private final boolean busy;

    public ResourceStats(int id, long useCount, Instant lastUsed, boolean busy) {
        this.id = id;
        this.useCount = useCount;
        this.lastUsed = lastUsed;
        this.busy = busy;
    }

    static ResourceStats of(ResourceRecord record) {
        return new ResourceStats(record.getId(), record.getUseCount(), record.getLastUsed(), record.isBusy());
    }

    public int getId() {
        return id;
    }

    public long getUseCount() {
        return useCount;
    }

    public Instant getLastUsed() {
        return lastUsed;
    }

    public boolean isBusy() {
        return busy;
    }

    @Override
    public String toString() {
        return String.format("Resource[id=%d, useCount=%d, lastUsed=%s, busy=%s]", id, useCount, lastUsed, busy);
    }
}
