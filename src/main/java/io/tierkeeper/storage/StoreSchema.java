package io.tierkeeper.storage;

import io.tierkeeper.model.ImageKey;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Column layout of the metadata store, resolved once when the store is opened.
 *
 * <p>All SQL issued against the store is built from this record, so column names never
 * need to be guessed again after negotiation.
 */
public record StoreSchema(
        String statsTable,
        String filenameColumn,
        String viewsColumn,
        String cameraColumn,
        String archiveColumn,
        String artifactsTable,
        String artifactLinkColumn,
        String artifactCameraColumn
) {
    public static final String STATS_TABLE = "image_stats";
    public static final String ARTIFACTS_TABLE = "saved_crops";

    static final List<String> FILENAME_CANDIDATES = List.of("filename", "file_name");
    static final List<String> VIEWS_CANDIDATES = List.of("total_views", "view_count", "views");
    static final List<String> CAMERA_CANDIDATES = List.of("camera_name", "camera");
    static final List<String> ARCHIVE_CANDIDATES = List.of("archived_path", "archive_path");
    static final List<String> ARTIFACT_LINK_CANDIDATES = List.of("original_filename", "filename");
    static final List<String> ARTIFACT_CAMERA_CANDIDATES = List.of("original_camera", "camera_name", "camera");

    static StoreSchema negotiate(Set<String> statsColumns, Set<String> artifactColumns) {
        if (statsColumns.isEmpty()) {
            throw new StoreUnavailableException("Metadata table not found: " + STATS_TABLE);
        }
        if (artifactColumns.isEmpty()) {
            throw new StoreUnavailableException("Metadata table not found: " + ARTIFACTS_TABLE);
        }
        return new StoreSchema(
                STATS_TABLE,
                require(STATS_TABLE, "filename", statsColumns, FILENAME_CANDIDATES),
                require(STATS_TABLE, "view count", statsColumns, VIEWS_CANDIDATES),
                pick(statsColumns, CAMERA_CANDIDATES).orElse(null),
                require(STATS_TABLE, "archive location", statsColumns, ARCHIVE_CANDIDATES),
                ARTIFACTS_TABLE,
                require(ARTIFACTS_TABLE, "original filename", artifactColumns, ARTIFACT_LINK_CANDIDATES),
                pick(artifactColumns, ARTIFACT_CAMERA_CANDIDATES).orElse(null)
        );
    }

    String lookupSql(int count) {
        return "SELECT s." + filenameColumn + " AS filename, MAX(s." + viewsColumn + ") AS views, "
                + "COUNT(c." + artifactLinkColumn + ") AS crops "
                + "FROM " + statsTable + " s LEFT JOIN " + artifactsTable + " c "
                + "ON s." + filenameColumn + " = c." + artifactLinkColumn + " "
                + "WHERE s." + filenameColumn + " IN (" + placeholders(count) + ") "
                + "GROUP BY s." + filenameColumn;
    }

    /**
     * Stats rows can be addressed by (camera, filename) only when the store records the camera.
     */
    boolean statsKeyedByCamera(ImageKey key) {
        return cameraColumn != null && key.hasCamera();
    }

    boolean artifactsKeyedByCamera(ImageKey key) {
        return artifactCameraColumn != null && key.hasCamera();
    }

    String markArchivedSql(boolean byCamera) {
        return "UPDATE " + statsTable + " SET " + archiveColumn + "=? WHERE " + filenameColumn + "=?"
                + (byCamera ? " AND " + cameraColumn + "=?" : "");
    }

    String deleteStatsSql(boolean byCamera) {
        return "DELETE FROM " + statsTable + " WHERE " + filenameColumn + "=?"
                + (byCamera ? " AND " + cameraColumn + "=?" : "");
    }

    String deleteArtifactsSql(boolean byCamera) {
        return "DELETE FROM " + artifactsTable + " WHERE " + artifactLinkColumn + "=?"
                + (byCamera ? " AND " + artifactCameraColumn + "=?" : "");
    }

    String listTrackedSql() {
        String camera = cameraColumn == null ? "NULL" : cameraColumn;
        return "SELECT " + camera + " AS camera, " + filenameColumn + " AS filename, "
                + archiveColumn + " AS archived_path FROM " + statsTable
                + " ORDER BY " + filenameColumn;
    }

    String danglingArtifactsSql() {
        return "SELECT COUNT(1) FROM " + artifactsTable + " c LEFT JOIN " + statsTable + " s "
                + "ON s." + filenameColumn + " = c." + artifactLinkColumn + " "
                + "WHERE s." + filenameColumn + " IS NULL";
    }

    private static String require(String table, String role, Set<String> columns, List<String> candidates) {
        return pick(columns, candidates).orElseThrow(() -> new StoreUnavailableException(
                "No " + role + " column in " + table + "; expected one of " + candidates + ", found " + columns
        ));
    }

    private static Optional<String> pick(Set<String> columns, List<String> candidates) {
        for (String candidate : candidates) {
            if (columns.contains(candidate.toLowerCase(Locale.ROOT))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String placeholders(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append('?');
        }
        return sb.toString();
    }
}
