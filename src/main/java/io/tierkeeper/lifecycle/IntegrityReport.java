package io.tierkeeper.lifecycle;

import java.util.List;

public record IntegrityReport(
        int trackedRows,
        int inHotTier,
        int inArchive,
        int orphanedRows,
        long danglingCropRows,
        int untrackedHotFiles,
        List<String> orphanSample
) {
    public IntegrityReport {
        orphanSample = orphanSample == null ? List.of() : List.copyOf(orphanSample);
    }

    public boolean clean() {
        return orphanedRows == 0 && danglingCropRows == 0L;
    }
}
