package hle.affinity;

import hle.affinity.dispatch.CommandResult;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregate view of a batch of dispatched commands: latency distribution over every
 * command, failures grouped by exception type, and throughput over the run's wall time.
 */
public final class LatencyStats {

    private final long[] sortedNanos;
    private final Duration wallTime;
    private final Map<String, Integer> failuresByType;
    private final String slowestCommandId;

    private LatencyStats(long[] sortedNanos, Duration wallTime,
                         Map<String, Integer> failuresByType, String slowestCommandId) {
        this.sortedNanos = sortedNanos;
        this.wallTime = wallTime;
        this.failuresByType = Collections.unmodifiableMap(failuresByType);
        this.slowestCommandId = slowestCommandId;
    }

    /**
     * Summarizes command results collected over one run.
     *
     * @param results every command's outcome, successful or not
     * @param wallTime time from the first submit to the last completion
     */
    public static LatencyStats of(List<? extends CommandResult<?>> results, Duration wallTime) {
        long[] nanos = new long[results.size()];
        Map<String, Integer> failures = new TreeMap<>();
        String slowest = null;
        long slowestNanos = -1;

        int i = 0;
        for (CommandResult<?> result : results) {
            long took = result.getDuration().toNanos();
            nanos[i++] = took;
            if (took > slowestNanos) {
                slowestNanos = took;
                slowest = result.getCommandId();
            }
            if (result.isFailure()) {
                String type = result.getException()
                        .map(e -> e.getClass().getSimpleName())
                        .orElse("Unknown");
                failures.merge(type, 1, Integer::sum);
            }
        }
        Arrays.sort(nanos);
        return new LatencyStats(nanos, wallTime, failures, slowest);
    }

    public int getRequests() {
        return sortedNanos.length;
    }

    public int getFailures() {
        return failuresByType.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Failure counts keyed by the simple name of the exception, in name order.
     */
    public Map<String, Integer> getFailuresByType() {
        return failuresByType;
    }

    public Duration getWallTime() {
        return wallTime;
    }

    public double getThroughputPerSec() {
        double seconds = wallTime.toNanos() / 1_000_000_000.0;
        return seconds > 0 ? sortedNanos.length / seconds : 0.0;
    }

    public Duration getAverage() {
        if (sortedNanos.length == 0) {
            return Duration.ZERO;
        }
        long total = 0;
        for (long nanos : sortedNanos) {
            total += nanos;
        }
        return Duration.ofNanos(total / sortedNanos.length);
    }

    /**
     * Nearest-rank percentile of command latency.
     *
     * @param fraction between 0 (exclusive) and 1 (inclusive), e.g. 0.95
     */
    public Duration percentile(double fraction) {
        if (fraction <= 0 || fraction > 1) {
            throw new IllegalArgumentException("fraction must be in (0, 1]: " + fraction);
        }
        if (sortedNanos.length == 0) {
            return Duration.ZERO;
        }
        int rank = (int) Math.ceil(fraction * sortedNanos.length);
        return Duration.ofNanos(sortedNanos[Math.max(rank, 1) - 1]);
    }

    public Optional<String> getSlowestCommandId() {
        return Optional.ofNullable(slowestCommandId);
    }
}
