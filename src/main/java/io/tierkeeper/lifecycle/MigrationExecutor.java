package io.tierkeeper.lifecycle;

import io.tierkeeper.model.FileRecord;
import io.tierkeeper.model.ImageKey;
import io.tierkeeper.model.MigrationResult;
import io.tierkeeper.model.MigrationStatus;
import io.tierkeeper.observability.AuditLogger;
import io.tierkeeper.storage.MetadataStore;
import io.tierkeeper.storage.StoreUnavailableException;
import io.tierkeeper.tier.Pacer;
import io.tierkeeper.tier.TierOperations;
import io.tierkeeper.util.Bytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Moves matched hot-tier files into the archive tier and keeps the metadata store in step.
 *
 * <p>A move is attempted once. A file that cannot be moved for any reason other than having
 * vanished is deleted from the hot tier together with its metadata rows, so the hot tier never
 * keeps files it could not place. Only a failed delete after a failed move leaves a file behind.
 *
 * <p>Metadata is written in two independent batches after all file operations: rows of purged
 * files are deleted, then the archive location of moved files is recorded.
 */
public final class MigrationExecutor {
    private static final Logger log = LoggerFactory.getLogger(MigrationExecutor.class);

    private final Path hotRoot;
    private final Path archiveRoot;
    private final String archiveNamespace;
    private final MetadataStore store;
    private final TierOperations ops;
    private final Pacer pacer;
    private final AuditLogger audit;

    public MigrationExecutor(
            Path hotRoot,
            Path archiveRoot,
            String archiveNamespace,
            MetadataStore store,
            TierOperations ops,
            Pacer pacer,
            AuditLogger audit
    ) {
        this.hotRoot = hotRoot.toAbsolutePath().normalize();
        this.archiveRoot = archiveRoot.toAbsolutePath().normalize();
        this.archiveNamespace = archiveNamespace;
        this.store = store;
        this.ops = ops;
        this.pacer = pacer;
        this.audit = audit;
    }

    /**
     * Archive path for a hot-tier file: archive root, namespace, then the path relative to the hot root.
     */
    public Path destinationFor(Path source) {
        Path normalized = source.toAbsolutePath().normalize();
        Path base = archiveRoot.resolve(archiveNamespace);
        if (normalized.startsWith(hotRoot) && !normalized.equals(hotRoot)) {
            return base.resolve(hotRoot.relativize(normalized));
        }
        return base.resolve(normalized.getFileName());
    }

    /**
     * Metadata identity of a hot-tier file: the first directory under the hot root names the
     * camera. Files directly under the hot root, or outside it, are identified by filename only.
     */
    public ImageKey imageKeyFor(FileRecord file) {
        Path normalized = file.path().toAbsolutePath().normalize();
        String camera = null;
        if (normalized.startsWith(hotRoot)) {
            Path relative = hotRoot.relativize(normalized);
            if (relative.getNameCount() >= 2) {
                camera = relative.getName(0).toString();
            }
        }
        return ImageKey.of(camera, file.filename());
    }

    public MigrationReport migrate(Collection<FileRecord> matched, boolean dryRun) {
        List<FileRecord> files = distinct(matched);
        if (files.isEmpty()) {
            log.info("No files to migrate");
            return MigrationReport.of(MigrationReport.Status.NOTHING_TO_DO, 0);
        }
        boolean archiveAvailable = Files.isDirectory(archiveRoot);
        if (dryRun) {
            if (!archiveAvailable) {
                log.warn("[DRY RUN] Archive root {} is not available; a live run would skip these {} files",
                        archiveRoot, files.size());
            }
            return plan(files, archiveAvailable ? MigrationReport.Status.DRY_RUN : MigrationReport.Status.ARCHIVE_UNAVAILABLE);
        }
        if (!archiveAvailable) {
            log.error("Archive root {} is not available; skipping migration of {} files", archiveRoot, files.size());
            return MigrationReport.of(MigrationReport.Status.ARCHIVE_UNAVAILABLE, files.size());
        }
        return execute(files);
    }

    private MigrationReport plan(List<FileRecord> files, MigrationReport.Status status) {
        List<MigrationResult> results = new ArrayList<>();
        int wouldMove = 0;
        int vanished = 0;
        long wouldMoveBytes = 0L;
        for (FileRecord file : files) {
            String source = file.path().toString();
            String destination = destinationFor(file.path()).toString();
            try {
                long size = Files.size(file.path());
                wouldMove++;
                wouldMoveBytes += size;
                results.add(new MigrationResult(source, destination, size, MigrationStatus.PLANNED, null));
            } catch (IOException e) {
                vanished++;
                results.add(new MigrationResult(source, destination, 0L, MigrationStatus.SKIPPED_TRANSIENT, "file vanished"));
            }
        }
        log.info("[DRY RUN] Would move {} files ({}) to {}", wouldMove, Bytes.format(wouldMoveBytes),
                archiveRoot.resolve(archiveNamespace));
        audit.log(AuditLogger.AuditEvent.of(
                "lifecycle.migrate",
                hotRoot.toString(),
                "planned",
                true,
                Map.of("files", wouldMove, "bytes", wouldMoveBytes)
        ));
        return new MigrationReport(
                status,
                files.size(),
                wouldMove,
                0,
                vanished,
                0,
                wouldMoveBytes,
                0L,
                0,
                0,
                0,
                List.of(),
                results
        );
    }

    private MigrationReport execute(List<FileRecord> files) {
        log.info("Migrating {} files to {}", files.size(), archiveRoot.resolve(archiveNamespace));
        List<MigrationResult> results = new ArrayList<>();
        Map<ImageKey, String> archivedByImage = new LinkedHashMap<>();
        List<FileRecord> failedMoves = new ArrayList<>();
        boolean interrupted = false;
        long bytesMoved = 0L;
        int moved = 0;
        int skipped = 0;

        for (int i = 0; i < files.size(); i++) {
            if (i > 0 && !interrupted) {
                interrupted = pace();
            }
            if (Thread.interrupted()) {
                interrupted = true;
            }
            if (interrupted) {
                log.warn("Interrupted; leaving {} files in the hot tier for the next cycle", files.size() - i);
                break;
            }
            FileRecord file = files.get(i);
            Path destination = destinationFor(file.path());
            try {
                ops.move(file.path(), destination);
                archivedByImage.put(imageKeyFor(file), destination.toString());
                moved++;
                bytesMoved += file.sizeBytes();
                results.add(new MigrationResult(file.path().toString(), destination.toString(), file.sizeBytes(),
                        MigrationStatus.MOVED, null));
                audit.log(AuditLogger.AuditEvent.of(
                        "lifecycle.migrate",
                        file.path().toString(),
                        "moved",
                        false,
                        Map.of("destination", destination.toString(), "bytes", file.sizeBytes())
                ));
            } catch (NoSuchFileException e) {
                skipped++;
                results.add(new MigrationResult(file.path().toString(), destination.toString(), file.sizeBytes(),
                        MigrationStatus.SKIPPED_TRANSIENT, "file vanished before move"));
            } catch (IOException | RuntimeException e) {
                log.error("Failed to move {} to {}; it will be purged: {}", file.path(), destination, e.toString());
                failedMoves.add(file);
            }
        }
        if (moved > 0) {
            log.info("Moved {} files ({})", moved, Bytes.format(bytesMoved));
        }

        List<ImageKey> purgedImages = new ArrayList<>();
        long bytesPurged = 0L;
        int fatal = 0;
        for (int i = 0; i < failedMoves.size(); i++) {
            if (i > 0 && !interrupted) {
                interrupted = pace();
            }
            FileRecord file = failedMoves.get(i);
            String source = file.path().toString();
            try {
                ops.delete(file.path());
                purgedImages.add(imageKeyFor(file));
                bytesPurged += file.sizeBytes();
                results.add(new MigrationResult(source, null, file.sizeBytes(), MigrationStatus.PURGED, "move failed"));
                audit.log(AuditLogger.AuditEvent.of("lifecycle.purge", source, "purged", false,
                        Map.of("bytes", file.sizeBytes())));
            } catch (NoSuchFileException e) {
                purgedImages.add(imageKeyFor(file));
                results.add(new MigrationResult(source, null, file.sizeBytes(), MigrationStatus.PURGED,
                        "file already gone"));
            } catch (IOException | RuntimeException e) {
                fatal++;
                log.error("Failed to delete {} after failed move; manual intervention required: {}", source, e.toString());
                results.add(new MigrationResult(source, null, file.sizeBytes(), MigrationStatus.FAILED_FATAL,
                        e.toString()));
                audit.log(AuditLogger.AuditEvent.of("lifecycle.purge", source, "failed", false,
                        Map.of("error", e.toString())));
            }
        }
        if (!purgedImages.isEmpty()) {
            log.warn("Purged {} files ({}) that could not be moved", purgedImages.size(), Bytes.format(bytesPurged));
        }

        List<String> metadataErrors = new ArrayList<>();
        int statsDeleted = 0;
        int cropsDeleted = 0;
        if (!purgedImages.isEmpty()) {
            try {
                MetadataStore.PurgeCounts counts = store.deleteImages(purgedImages);
                statsDeleted = counts.statsRows();
                cropsDeleted = counts.artifactRows();
                log.info("Removed metadata of {} purged files ({} stats rows, {} crop rows)",
                        purgedImages.size(), statsDeleted, cropsDeleted);
            } catch (StoreUnavailableException e) {
                log.error("Failed to remove metadata of {} purged files: {}", purgedImages.size(), e.getMessage(), e);
                metadataErrors.add("purge: " + e.getMessage());
            }
        }
        int recorded = 0;
        if (!archivedByImage.isEmpty()) {
            try {
                recorded = store.markArchived(archivedByImage);
                log.info("Recorded archive location for {} stats rows", recorded);
            } catch (StoreUnavailableException e) {
                log.error("Files were archived but their metadata is stale ({} files): {}",
                        archivedByImage.size(), e.getMessage(), e);
                metadataErrors.add("archive location: " + e.getMessage());
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new MigrationReport(
                interrupted ? MigrationReport.Status.INTERRUPTED : MigrationReport.Status.COMPLETED,
                files.size(),
                moved,
                purgedImages.size(),
                skipped,
                fatal,
                bytesMoved,
                bytesPurged,
                recorded,
                statsDeleted,
                cropsDeleted,
                metadataErrors,
                results
        );
    }

    /**
     * @return true when the pause was interrupted
     */
    private boolean pace() {
        try {
            pacer.pause();
            return false;
        } catch (InterruptedException e) {
            return true;
        }
    }

    private static List<FileRecord> distinct(Collection<FileRecord> files) {
        if (files == null || files.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<Path> seen = new LinkedHashSet<>();
        List<FileRecord> out = new ArrayList<>();
        for (FileRecord file : files) {
            if (seen.add(file.path().toAbsolutePath().normalize())) {
                out.add(file);
            }
        }
        return out;
    }
}
