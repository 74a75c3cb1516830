package io.tierkeeper.lifecycle;

/**
 * Archive space limits for one eviction pass.
 *
 * @param targetFreeBytes free space the archive filesystem should have after eviction
 * @param maxCleanupBytes upper bound on bytes deleted in one invocation
 * @param scanLimit       only this many of the oldest archive files are considered
 */
public record EvictionPolicy(long targetFreeBytes, long maxCleanupBytes, int scanLimit) {

    public EvictionPolicy {
        if (targetFreeBytes < 0L || maxCleanupBytes < 0L) {
            throw new IllegalArgumentException("eviction byte limits must be >= 0");
        }
        if (scanLimit < 1) {
            throw new IllegalArgumentException("scanLimit must be >= 1");
        }
    }
}
