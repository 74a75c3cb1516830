package io.tierkeeper.lifecycle;

import io.tierkeeper.model.DiskUsage;
import io.tierkeeper.observability.AuditLogger;
import io.tierkeeper.testutil.FailingTierOperations;
import io.tierkeeper.testutil.MutableClock;
import io.tierkeeper.testutil.ScriptedDiskUsageProbe;
import io.tierkeeper.testutil.TestFiles;
import io.tierkeeper.tier.CandidateScanner;
import io.tierkeeper.tier.Pacer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class ArchiveEvictorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final long TOTAL = 100_000L;

    @Test
    void deletesOldestFilesUntilBudgetThenStops() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-evict-budget-");
        try {
            List<Path> files = archiveFiles(root, 5, 600);
            ScriptedDiskUsageProbe probe = new ScriptedDiskUsageProbe()
                    .then(usage(3_000L))
                    .then(usage(4_800L));
            FailingTierOperations ops = new FailingTierOperations();

            EvictionReport report = evictor(root, probe, ops)
                    .evict(root.resolve("archive"), archiveDir(root), new EvictionPolicy(5_000L, 10_000L, 1000), false);

            Assertions.assertEquals(EvictionReport.Status.COMPLETED, report.status());
            Assertions.assertEquals(2_000L, report.budgetBytes());
            Assertions.assertEquals(3, report.deleted());
            Assertions.assertEquals(1_800L, report.bytesFreed());
            Assertions.assertEquals(List.of(files.get(0), files.get(1), files.get(2)), ops.deleted());
            Assertions.assertTrue(Files.exists(files.get(3)));
            Assertions.assertTrue(Files.exists(files.get(4)));
            Assertions.assertFalse(report.targetReached());
            Assertions.assertEquals(4_800L, report.after().freeBytes());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void maxCleanupCapsDeletionEvenWhenFarBelowTarget() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-evict-cap-");
        try {
            archiveFiles(root, 10, 300);
            FailingTierOperations ops = new FailingTierOperations();

            EvictionReport report = evictor(root, new ScriptedDiskUsageProbe().then(usage(0L)), ops)
                    .evict(root.resolve("archive"), archiveDir(root), new EvictionPolicy(50_000L, 1_000L, 1000), false);

            Assertions.assertEquals(3, report.deleted());
            Assertions.assertTrue(report.bytesFreed() <= 1_000L);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void sufficientFreeSpaceIsNoOp() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-evict-noop-");
        try {
            List<Path> files = archiveFiles(root, 2, 100);
            ScriptedDiskUsageProbe probe = new ScriptedDiskUsageProbe().then(usage(5_000L));
            FailingTierOperations ops = new FailingTierOperations();

            EvictionReport report = evictor(root, probe, ops)
                    .evict(root.resolve("archive"), archiveDir(root), new EvictionPolicy(5_000L, 10_000L, 1000), false);

            Assertions.assertEquals(EvictionReport.Status.NOT_NEEDED, report.status());
            Assertions.assertTrue(report.targetReached());
            Assertions.assertTrue(ops.deleted().isEmpty());
            Assertions.assertTrue(Files.exists(files.get(0)));
            Assertions.assertEquals(1, probe.calls());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void probeFailureSkipsEviction() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-evict-probe-");
        try {
            archiveFiles(root, 2, 100);
            FailingTierOperations ops = new FailingTierOperations();

            EvictionReport report = evictor(root, new ScriptedDiskUsageProbe().failing(), ops)
                    .evict(root.resolve("archive"), archiveDir(root), new EvictionPolicy(5_000L, 10_000L, 1000), false);

            Assertions.assertEquals(EvictionReport.Status.PROBE_FAILED, report.status());
            Assertions.assertFalse(report.before().available());
            Assertions.assertTrue(ops.deleted().isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void dryRunPlansWithoutDeleting() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-evict-dry-");
        try {
            List<Path> files = archiveFiles(root, 4, 500);
            FailingTierOperations ops = new FailingTierOperations();

            EvictionReport report = evictor(root, new ScriptedDiskUsageProbe().then(usage(4_000L)), ops)
                    .evict(root.resolve("archive"), archiveDir(root), new EvictionPolicy(5_000L, 10_000L, 1000), true);

            Assertions.assertEquals(EvictionReport.Status.DRY_RUN, report.status());
            Assertions.assertEquals(2, report.planned());
            Assertions.assertEquals(1_000L, report.plannedBytes());
            Assertions.assertEquals(files.get(0).toString(), report.oldestPlanned());
            Assertions.assertEquals(files.get(1).toString(), report.newestPlanned());
            Assertions.assertTrue(ops.deleted().isEmpty());
            for (Path file : files) {
                Assertions.assertTrue(Files.exists(file));
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void deleteFailureIsSkippedAndOthersContinue() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-evict-fail-");
        try {
            List<Path> files = archiveFiles(root, 3, 100);
            FailingTierOperations ops = new FailingTierOperations().failDelete(files.get(0));

            EvictionReport report = evictor(root, new ScriptedDiskUsageProbe().then(usage(0L)), ops)
                    .evict(root.resolve("archive"), archiveDir(root), new EvictionPolicy(10_000L, 10_000L, 1000), false);

            Assertions.assertEquals(1, report.failed());
            Assertions.assertEquals(2, report.deleted());
            Assertions.assertTrue(Files.exists(files.get(0)));
            Assertions.assertFalse(Files.exists(files.get(1)));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void fileRemovedByAnotherProcessIsNotAFailure() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-evict-vanish-");
        try {
            List<Path> files = archiveFiles(root, 3, 100);
            FailingTierOperations ops = new FailingTierOperations().vanishOnDelete(files.get(1));

            EvictionReport report = evictor(root, new ScriptedDiskUsageProbe().then(usage(0L)), ops)
                    .evict(root.resolve("archive"), archiveDir(root), new EvictionPolicy(10_000L, 10_000L, 1000), false);

            Assertions.assertEquals(EvictionReport.Status.COMPLETED, report.status());
            Assertions.assertEquals(0, report.failed());
            Assertions.assertTrue(report.failures().isEmpty());
            Assertions.assertEquals(2, report.deleted());
            Assertions.assertEquals(List.of(files.get(0), files.get(2)), ops.deleted());
            for (Path file : files) {
                Assertions.assertFalse(Files.exists(file), file.toString());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static ArchiveEvictor evictor(Path root, ScriptedDiskUsageProbe probe, FailingTierOperations ops) {
        MutableClock clock = new MutableClock(NOW);
        return new ArchiveEvictor(
                probe,
                new CandidateScanner(clock),
                ops,
                Pacer.none(),
                new AuditLogger(root.resolve("audit").resolve("lifecycle-audit.jsonl"), clock)
        );
    }

    private static Path archiveDir(Path root) {
        return root.resolve("archive").resolve("archived");
    }

    private static DiskUsage usage(long free) {
        return new DiskUsage(TOTAL, TOTAL - free, free);
    }

    /**
     * Files are returned oldest first and spread over two source directories.
     */
    private static List<Path> archiveFiles(Path root, int count, int size) throws Exception {
        List<Path> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String camera = i % 2 == 0 ? "cam1" : "cam2";
            Path path = archiveDir(root).resolve(camera).resolve("img_" + i + ".jpg");
            out.add(TestFiles.write(path, size, NOW.minus(Duration.ofDays(30 - i))));
        }
        return out;
    }
}
