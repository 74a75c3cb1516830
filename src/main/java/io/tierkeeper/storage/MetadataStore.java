package io.tierkeeper.storage;

import io.tierkeeper.model.ImageKey;
import io.tierkeeper.model.ImageStats;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Batched reads and writes against the image metadata store.
 *
 * <p>Every method acquires its own connection and releases it on all paths. Failures surface as
 * {@link StoreUnavailableException}; write methods are all-or-nothing per call.
 */
public final class MetadataStore {
    static final int MAX_BATCH = 500;

    private final Database database;

    public MetadataStore(Database database) {
        this.database = database;
    }

    public Database database() {
        return database;
    }

    /**
     * Looks up view and crop counts for the given filenames. Names without a stats row are absent
     * from the result.
     */
    public Map<String, ImageStats> lookup(Collection<String> filenames) {
        List<String> names = distinct(filenames);
        Map<String, ImageStats> out = new HashMap<>();
        if (names.isEmpty()) {
            return out;
        }
        StoreSchema schema = database.schema();
        try (Connection c = database.openConnection()) {
            for (int from = 0; from < names.size(); from += MAX_BATCH) {
                List<String> chunk = names.subList(from, Math.min(names.size(), from + MAX_BATCH));
                try (PreparedStatement ps = c.prepareStatement(schema.lookupSql(chunk.size()))) {
                    int idx = 1;
                    for (String name : chunk) {
                        ps.setString(idx++, name);
                    }
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            String filename = rs.getString("filename");
                            out.put(filename, new ImageStats(filename, rs.getLong("views"), rs.getLong("crops")));
                        }
                    }
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed metadata lookup for " + names.size() + " files", e);
        }
    }

    /**
     * Sets the archive location of each image in a single transaction. Rows are matched by camera
     * and filename when both the store and the key carry a camera, otherwise by filename alone.
     *
     * @return number of stats rows updated
     */
    public int markArchived(Map<ImageKey, String> archivedPathByImage) {
        if (archivedPathByImage == null || archivedPathByImage.isEmpty()) {
            return 0;
        }
        StoreSchema schema = database.schema();
        List<ImageKey> byCamera = new ArrayList<>();
        List<ImageKey> byName = new ArrayList<>();
        for (ImageKey key : archivedPathByImage.keySet()) {
            if (schema.statsKeyedByCamera(key)) {
                byCamera.add(key);
            } else {
                byName.add(key);
            }
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int updated = executeBatch(c, schema.markArchivedSql(true), byCamera, true, archivedPathByImage)
                        + executeBatch(c, schema.markArchivedSql(false), byName, false, archivedPathByImage);
                c.commit();
                return updated;
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to record archive locations", e);
        }
    }

    /**
     * Removes the stats rows and linked crop rows of the given images in a single transaction.
     */
    public PurgeCounts deleteImages(Collection<ImageKey> images) {
        List<ImageKey> keys = distinctKeys(images);
        if (keys.isEmpty()) {
            return new PurgeCounts(0, 0);
        }
        StoreSchema schema = database.schema();
        List<ImageKey> statsByCamera = new ArrayList<>();
        List<ImageKey> statsByName = new ArrayList<>();
        List<ImageKey> cropsByCamera = new ArrayList<>();
        List<ImageKey> cropsByName = new ArrayList<>();
        for (ImageKey key : keys) {
            if (schema.statsKeyedByCamera(key)) {
                statsByCamera.add(key);
            } else {
                statsByName.add(key);
            }
            if (schema.artifactsKeyedByCamera(key)) {
                cropsByCamera.add(key);
            } else {
                cropsByName.add(key);
            }
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int statsDeleted = executeBatch(c, schema.deleteStatsSql(true), statsByCamera, true, null)
                        + executeBatch(c, schema.deleteStatsSql(false), statsByName, false, null);
                int cropsDeleted = executeBatch(c, schema.deleteArtifactsSql(true), cropsByCamera, true, null)
                        + executeBatch(c, schema.deleteArtifactsSql(false), cropsByName, false, null);
                c.commit();
                return new PurgeCounts(statsDeleted, cropsDeleted);
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to delete metadata for purged files", e);
        }
    }

    public List<TrackedImage> listTracked() {
        StoreSchema schema = database.schema();
        List<TrackedImage> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(schema.listTrackedSql())) {
            while (rs.next()) {
                out.add(new TrackedImage(
                        rs.getString("camera"),
                        rs.getString("filename"),
                        rs.getString("archived_path")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list tracked images", e);
        }
    }

    /**
     * Counts crop rows whose original image has no stats row.
     */
    public long countDanglingArtifacts() {
        StoreSchema schema = database.schema();
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(schema.danglingArtifactsSql())) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count dangling crop rows", e);
        }
    }

    /**
     * Binds {@code [value,] filename [, camera]} for each key; {@code values} is null for deletes.
     */
    private static int executeBatch(
            Connection c,
            String sql,
            List<ImageKey> keys,
            boolean byCamera,
            Map<ImageKey, String> values
    ) throws SQLException {
        if (keys.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (ImageKey key : keys) {
                int idx = 1;
                if (values != null) {
                    ps.setString(idx++, values.get(key));
                }
                ps.setString(idx++, key.filename());
                if (byCamera) {
                    ps.setString(idx, key.camera());
                }
                ps.addBatch();
            }
            return sum(ps.executeBatch());
        }
    }

    static void rollback(Connection c, Exception failure) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    private static List<String> distinct(Collection<String> filenames) {
        if (filenames == null || filenames.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String name : filenames) {
            if (name != null && !name.isBlank()) {
                out.add(name);
            }
        }
        return new ArrayList<>(out);
    }

    private static List<ImageKey> distinctKeys(Collection<ImageKey> images) {
        if (images == null || images.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<ImageKey> out = new LinkedHashSet<>();
        for (ImageKey key : images) {
            if (key != null && key.filename() != null && !key.filename().isBlank()) {
                out.add(key);
            }
        }
        return new ArrayList<>(out);
    }

    private static int sum(int[] counts) {
        int total = 0;
        for (int count : counts) {
            if (count > 0) {
                total += count;
            }
        }
        return total;
    }

    public record PurgeCounts(int statsRows, int artifactRows) {
    }

    public record TrackedImage(String camera, String filename, String archivedPath) {
    }
}
