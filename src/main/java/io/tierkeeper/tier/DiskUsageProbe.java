package io.tierkeeper.tier;

import io.tierkeeper.model.DiskUsage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reports capacity of the filesystem holding a tier root.
 */
@FunctionalInterface
public interface DiskUsageProbe {
    DiskUsage probe(Path tierRoot) throws IOException;

    static DiskUsageProbe fileStore() {
        return new FileStoreDiskUsageProbe();
    }
}
