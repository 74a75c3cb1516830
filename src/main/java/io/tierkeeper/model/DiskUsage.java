package io.tierkeeper.model;

public record DiskUsage(long totalBytes, long usedBytes, long freeBytes) {

    public static DiskUsage unavailable() {
        return new DiskUsage(0L, 0L, 0L);
    }

    public boolean available() {
        return totalBytes > 0L;
    }

    public double percentUsed() {
        if (totalBytes <= 0L) {
            return 0d;
        }
        return (usedBytes * 100d) / totalBytes;
    }
}
