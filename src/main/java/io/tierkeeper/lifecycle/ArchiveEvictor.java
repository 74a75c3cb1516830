package io.tierkeeper.lifecycle;

import io.tierkeeper.model.DiskUsage;
import io.tierkeeper.model.FileRecord;
import io.tierkeeper.observability.AuditLogger;
import io.tierkeeper.tier.CandidateScanner;
import io.tierkeeper.tier.DiskUsageProbe;
import io.tierkeeper.tier.Pacer;
import io.tierkeeper.tier.TierOperations;
import io.tierkeeper.util.Bytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Frees archive space by deleting the oldest archived files once free space drops below target.
 */
public final class ArchiveEvictor {
    private static final Logger log = LoggerFactory.getLogger(ArchiveEvictor.class);
    static final int PROGRESS_EVERY = 50;

    private final DiskUsageProbe probe;
    private final CandidateScanner scanner;
    private final TierOperations ops;
    private final Pacer pacer;
    private final AuditLogger audit;

    public ArchiveEvictor(DiskUsageProbe probe, CandidateScanner scanner, TierOperations ops, Pacer pacer, AuditLogger audit) {
        this.probe = probe;
        this.scanner = scanner;
        this.ops = ops;
        this.pacer = pacer;
        this.audit = audit;
    }

    /**
     * @param archiveRoot mount point whose free space is measured
     * @param archiveDir  directory whose files are eligible for deletion
     */
    public EvictionReport evict(Path archiveRoot, Path archiveDir, EvictionPolicy policy, boolean dryRun) {
        DiskUsage before = probe(archiveRoot);
        if (!before.available()) {
            log.error("Could not read disk usage of {}; skipping archive cleanup this cycle", archiveRoot);
            return EvictionReport.skipped(EvictionReport.Status.PROBE_FAILED, before, 0L, false);
        }
        log.info("Archive {}: {} free of {} ({}% used)", archiveRoot, Bytes.format(before.freeBytes()),
                Bytes.format(before.totalBytes()), String.format(Locale.ROOT, "%.1f", before.percentUsed()));

        long budget = EvictionPlan.budget(before.freeBytes(), policy.targetFreeBytes(), policy.maxCleanupBytes());
        if (before.freeBytes() >= policy.targetFreeBytes()) {
            log.info("Archive has sufficient space ({} free, target {})", Bytes.format(before.freeBytes()),
                    Bytes.format(policy.targetFreeBytes()));
            return EvictionReport.skipped(EvictionReport.Status.NOT_NEEDED, before, 0L, true);
        }
        log.warn("Archive free space {} is below target {}; cleanup budget {}", Bytes.format(before.freeBytes()),
                Bytes.format(policy.targetFreeBytes()), Bytes.format(budget));

        List<FileRecord> listed = scanner.listFiles(archiveDir);
        EvictionPlan plan = EvictionPlan.build(listed, budget, policy.scanLimit());
        if (plan.isEmpty()) {
            log.info("No archive files fit the cleanup budget ({} files listed)", listed.size());
            return EvictionReport.skipped(EvictionReport.Status.NOTHING_TO_EVICT, before, budget, false);
        }
        String oldest = plan.oldest().path().toString();
        String newest = plan.newest().path().toString();

        if (dryRun) {
            log.info("[DRY RUN] Would delete {} archive files ({}), oldest {} ({}), newest {} ({})",
                    plan.files().size(), Bytes.format(plan.plannedBytes()),
                    plan.oldest().filename(), plan.oldest().modifiedAt(),
                    plan.newest().filename(), plan.newest().modifiedAt());
            audit.log(AuditLogger.AuditEvent.of("archive.evict", archiveDir.toString(), "planned", true,
                    Map.of("files", plan.files().size(), "bytes", plan.plannedBytes())));
            long wouldBeFree = before.freeBytes() + plan.plannedBytes();
            return new EvictionReport(
                    EvictionReport.Status.DRY_RUN,
                    before,
                    before,
                    budget,
                    plan.files().size(),
                    plan.plannedBytes(),
                    plan.files().size(),
                    plan.plannedBytes(),
                    0,
                    oldest,
                    newest,
                    wouldBeFree >= policy.targetFreeBytes(),
                    List.of()
            );
        }

        log.info("Deleting {} archive files ({})", plan.files().size(), Bytes.format(plan.plannedBytes()));
        int deleted = 0;
        long freed = 0L;
        List<String> failures = new ArrayList<>();
        boolean interrupted = false;
        List<FileRecord> files = plan.files();
        for (int i = 0; i < files.size(); i++) {
            if (i > 0) {
                try {
                    pacer.pause();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted || Thread.currentThread().isInterrupted()) {
                interrupted = true;
                log.warn("Archive cleanup interrupted after {} of {} files", deleted, files.size());
                break;
            }
            FileRecord file = files.get(i);
            try {
                ops.delete(file.path());
                deleted++;
                freed += file.sizeBytes();
                if (deleted % PROGRESS_EVERY == 0) {
                    log.info("Deleted {}/{} archive files ({} freed)", deleted, files.size(), Bytes.format(freed));
                }
            } catch (NoSuchFileException e) {
                log.debug("Archive file {} already gone", file.path());
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to delete archive file {}: {}", file.path(), e.toString());
                failures.add(file.path() + ": " + e);
            }
        }

        DiskUsage after = probe(archiveRoot);
        boolean reached = after.available() && after.freeBytes() >= policy.targetFreeBytes();
        log.info("Archive cleanup deleted {} files, freed {}; now {} free{}", deleted, Bytes.format(freed),
                Bytes.format(after.freeBytes()), reached ? "" : " (still below target)");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("files", deleted);
        details.put("bytes", freed);
        details.put("failed", failures.size());
        details.put("oldest", oldest);
        details.put("newest", newest);
        audit.log(AuditLogger.AuditEvent.of("archive.evict", archiveDir.toString(),
                interrupted ? "interrupted" : "completed", false, details));

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new EvictionReport(
                interrupted ? EvictionReport.Status.INTERRUPTED : EvictionReport.Status.COMPLETED,
                before,
                after,
                budget,
                files.size(),
                plan.plannedBytes(),
                deleted,
                freed,
                failures.size(),
                oldest,
                newest,
                reached,
                failures
        );
    }

    private DiskUsage probe(Path root) {
        try {
            return probe.probe(root);
        } catch (IOException | RuntimeException e) {
            log.warn("Disk usage probe failed for {}: {}", root, e.toString());
            return DiskUsage.unavailable();
        }
    }
}
