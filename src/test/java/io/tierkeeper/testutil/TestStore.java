package io.tierkeeper.testutil;

import io.tierkeeper.storage.Database;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Seeds and inspects a real SQLite metadata store in a temp directory.
 */
public final class TestStore {
    private TestStore() {
    }

    public static Database create(Path dbFile) {
        Database db = new Database(dbFile, 2_000L);
        db.initSchema();
        return db;
    }

    public static void addStats(Database db, String camera, String filename, long views) throws SQLException {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO image_stats(camera_name, filename, total_views) VALUES (?, ?, ?)")) {
            ps.setString(1, camera);
            ps.setString(2, filename);
            ps.setLong(3, views);
            ps.executeUpdate();
        }
    }

    public static void addCrop(Database db, String camera, String filename) throws SQLException {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO saved_crops(original_camera, original_filename, crop_filename, crop_folder) "
                             + "VALUES (?, ?, ?, ?)")) {
            ps.setString(1, camera);
            ps.setString(2, filename);
            ps.setString(3, "crop_" + System.nanoTime() + "_" + filename);
            ps.setString(4, "saved_crops/" + camera);
            ps.executeUpdate();
        }
    }

    public static String archivedPath(Database db, String filename) throws SQLException {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT archived_path FROM image_stats WHERE filename=?")) {
            ps.setString(1, filename);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    public static String archivedPath(Database db, String camera, String filename) throws SQLException {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT archived_path FROM image_stats WHERE camera_name=? AND filename=?")) {
            ps.setString(1, camera);
            ps.setString(2, filename);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    public static long countStats(Database db, String camera, String filename) throws SQLException {
        return count(db, "SELECT COUNT(1) FROM image_stats WHERE camera_name=? AND filename=?", camera, filename);
    }

    public static long countCrops(Database db, String camera, String filename) throws SQLException {
        return count(db, "SELECT COUNT(1) FROM saved_crops WHERE original_camera=? AND original_filename=?",
                camera, filename);
    }

    public static long countStats(Database db, String filename) throws SQLException {
        return count(db, "SELECT COUNT(1) FROM image_stats WHERE filename=?", filename);
    }

    public static long countCrops(Database db, String filename) throws SQLException {
        return count(db, "SELECT COUNT(1) FROM saved_crops WHERE original_filename=?", filename);
    }

    private static long count(Database db, String sql, String... params) throws SQLException {
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }
}
