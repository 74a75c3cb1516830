package io.tierkeeper.lifecycle;

import io.tierkeeper.model.DiskUsage;

import java.util.List;

/**
 * Outcome of one eviction pass. In a dry run {@code deleted} and {@code bytesFreed} are the
 * would-delete totals.
 */
public record EvictionReport(
        Status status,
        DiskUsage before,
        DiskUsage after,
        long budgetBytes,
        int planned,
        long plannedBytes,
        int deleted,
        long bytesFreed,
        int failed,
        String oldestPlanned,
        String newestPlanned,
        boolean targetReached,
        List<String> failures
) {
    public enum Status {
        NOT_NEEDED,
        PROBE_FAILED,
        NOTHING_TO_EVICT,
        DRY_RUN,
        COMPLETED,
        INTERRUPTED
    }

    public EvictionReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    static EvictionReport skipped(Status status, DiskUsage usage, long budgetBytes, boolean targetReached) {
        return new EvictionReport(status, usage, usage, budgetBytes, 0, 0L, 0, 0L, 0, null, null, targetReached, List.of());
    }
}
