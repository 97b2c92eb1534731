package hle.affinity.pool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of an {@link AffinityPool}, for health and status reporting.
 */
public final class PoolStatus {

    private final List<ResourceStats> resources;
    private final int activeCount;
    private final int idleCount;
    private final int maxPoolSize;
    private final boolean closed;

    PoolStatus(List<ResourceStats> resources, int activeCount, int idleCount, int maxPoolSize, boolean closed) {
        this.resources = List.copyOf(resources);
        this.activeCount = activeCount;
        this.idleCount = idleCount;
        this.maxPoolSize = maxPoolSize;
        this.closed = closed;
    }

    /**
     * Returns per-resource statistics ordered by resource id.
     */
    public List<ResourceStats> getResources() {
        return resources;
    }

    /**
     * Returns per-resource statistics keyed by resource id.
     */
    public Map<Integer, ResourceStats> getResourcesById() {
        Map<Integer, ResourceStats> byId = new LinkedHashMap<>();
        for (ResourceStats stats : resources) {
            byId.put(stats.getId(), stats);
        }
        return Collections.unmodifiableMap(byId);
    }

    /**
     * Returns the number of live resources, busy or idle.
     */
    public int getActiveCount() {
        return activeCount;
    }

    /**
     * Returns the number of resources waiting in the free registry.
     */
    public int getIdleCount() {
        return idleCount;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return String.format("AffinityPool[active=%d, idle=%d, max=%d, closed=%s]",
                activeCount, idleCount, maxPoolSize, closed);
    }
}
