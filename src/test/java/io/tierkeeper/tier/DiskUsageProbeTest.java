package io.tierkeeper.tier;

import io.tierkeeper.model.DiskUsage;
import io.tierkeeper.testutil.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class DiskUsageProbeTest {

    @Test
    void fileStoreProbeReportsCapacityOfExistingRoot() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-probe-");
        try {
            DiskUsage usage = DiskUsageProbe.fileStore().probe(root);
            Assertions.assertTrue(usage.available());
            Assertions.assertTrue(usage.freeBytes() <= usage.totalBytes());
            Assertions.assertTrue(usage.percentUsed() >= 0d && usage.percentUsed() <= 100d);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void missingRootFailsProbe() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-probe-missing-");
        try {
            Assertions.assertThrows(IOException.class, () -> DiskUsageProbe.fileStore().probe(root.resolve("unmounted")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
