package io.tierkeeper.lifecycle;

import io.tierkeeper.model.FileRecord;
import io.tierkeeper.storage.MetadataStore;
import io.tierkeeper.tier.CandidateScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only comparison of metadata rows against the files actually present in both tiers.
 */
public final class IntegrityScanner {
    private static final Logger log = LoggerFactory.getLogger(IntegrityScanner.class);

    private final MetadataStore store;
    private final CandidateScanner scanner;

    public IntegrityScanner(MetadataStore store, CandidateScanner scanner) {
        this.store = store;
        this.scanner = scanner;
    }

    /**
     * A row is in the archive when its recorded archive location exists, in the hot tier when a
     * hot file has its filename, and orphaned otherwise.
     *
     * @throws io.tierkeeper.storage.StoreUnavailableException when the store cannot be read
     */
    public IntegrityReport scan(Path hotRoot, int sampleSize) {
        Set<String> hotNames = new HashSet<>();
        for (FileRecord file : scanner.listFiles(hotRoot)) {
            hotNames.add(file.filename());
        }
        List<MetadataStore.TrackedImage> rows = store.listTracked();
        Set<String> trackedNames = new HashSet<>();
        int inHot = 0;
        int inArchive = 0;
        int orphaned = 0;
        List<String> sample = new ArrayList<>();
        for (MetadataStore.TrackedImage row : rows) {
            trackedNames.add(row.filename());
            if (row.archivedPath() != null && !row.archivedPath().isBlank()
                    && Files.exists(Path.of(row.archivedPath()))) {
                inArchive++;
            } else if (hotNames.contains(row.filename())) {
                inHot++;
            } else {
                orphaned++;
                if (sample.size() < sampleSize) {
                    sample.add(row.camera() == null ? row.filename() : row.camera() + "/" + row.filename());
                }
            }
        }
        int untracked = 0;
        for (String name : hotNames) {
            if (!trackedNames.contains(name)) {
                untracked++;
            }
        }
        long dangling = store.countDanglingArtifacts();
        log.info("Integrity: {} rows, {} in hot tier, {} archived, {} orphaned, {} dangling crop rows, {} untracked files",
                rows.size(), inHot, inArchive, orphaned, dangling, untracked);
        return new IntegrityReport(rows.size(), inHot, inArchive, orphaned, dangling, untracked, sample);
    }
}
