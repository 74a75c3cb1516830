package io.tierkeeper.lifecycle;

import io.tierkeeper.model.FileRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Oldest-first prefix of archive files whose cumulative size stays within a byte budget.
 */
public record EvictionPlan(long budgetBytes, List<FileRecord> files, long plannedBytes) {

    public EvictionPlan {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * {@code min(target - free, maxCleanup)}, or zero when free space already meets the target.
     */
    public static long budget(long freeBytes, long targetFreeBytes, long maxCleanupBytes) {
        if (freeBytes >= targetFreeBytes) {
            return 0L;
        }
        return Math.max(0L, Math.min(targetFreeBytes - freeBytes, maxCleanupBytes));
    }

    /**
     * Sorts by modification time (stable, so ties keep listing order), keeps the oldest
     * {@code scanLimit} and takes files until the next one would exceed the budget.
     */
    public static EvictionPlan build(List<FileRecord> listed, long budgetBytes, int scanLimit) {
        List<FileRecord> oldestFirst = new ArrayList<>(listed);
        oldestFirst.sort(Comparator.comparing(FileRecord::modifiedAt));
        if (oldestFirst.size() > scanLimit) {
            oldestFirst = oldestFirst.subList(0, scanLimit);
        }
        return greedyPrefix(oldestFirst, budgetBytes);
    }

    /**
     * Stops at the first file that does not fit; smaller files further on are not considered.
     */
    public static EvictionPlan greedyPrefix(List<FileRecord> oldestFirst, long budgetBytes) {
        List<FileRecord> planned = new ArrayList<>();
        long total = 0L;
        for (FileRecord file : oldestFirst) {
            if (total + file.sizeBytes() > budgetBytes) {
                break;
            }
            planned.add(file);
            total += file.sizeBytes();
        }
        return new EvictionPlan(budgetBytes, planned, total);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public FileRecord oldest() {
        return files.isEmpty() ? null : files.get(0);
    }

    public FileRecord newest() {
        return files.isEmpty() ? null : files.get(files.size() - 1);
    }
}
