package io.tierkeeper.lifecycle;

import io.tierkeeper.model.MigrationResult;

import java.util.List;

/**
 * Summary of one executor invocation. In a dry run {@code moved} and {@code bytesMoved} hold the
 * would-move totals and no other counter is touched. A dry run against a missing archive root
 * still carries its plan, with status {@link Status#ARCHIVE_UNAVAILABLE}.
 */
public record MigrationReport(
        Status status,
        int requested,
        int moved,
        int purged,
        int skipped,
        int failed,
        long bytesMoved,
        long bytesPurged,
        int archiveLocationsRecorded,
        int statsRowsDeleted,
        int cropRowsDeleted,
        List<String> metadataErrors,
        List<MigrationResult> results
) {
    public enum Status {
        NOTHING_TO_DO,
        DRY_RUN,
        COMPLETED,
        ARCHIVE_UNAVAILABLE,
        INTERRUPTED
    }

    public MigrationReport {
        metadataErrors = metadataErrors == null ? List.of() : List.copyOf(metadataErrors);
        results = results == null ? List.of() : List.copyOf(results);
    }

    static MigrationReport of(Status status, int requested) {
        return new MigrationReport(status, requested, 0, 0, 0, 0, 0L, 0L, 0, 0, 0, List.of(), List.of());
    }

    public boolean metadataConsistent() {
        return metadataErrors.isEmpty();
    }
}
