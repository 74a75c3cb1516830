package io.tierkeeper.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Connection source for the shared SQLite metadata store.
 *
 * <p>The store belongs to the image-serving application; this class never creates it
 * implicitly. Connections wait at most {@code busyTimeoutMs} for locks held by other processes.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Path dbFile;
    private final String jdbcUrl;
    private final long busyTimeoutMs;
    private volatile StoreSchema schema;

    public Database(Path dbFile, long busyTimeoutMs) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
        this.busyTimeoutMs = Math.max(0L, busyTimeoutMs);
    }

    public Path dbFile() {
        return dbFile;
    }

    public boolean exists() {
        return Files.isRegularFile(dbFile);
    }

    public Connection openConnection() throws SQLException {
        if (!exists()) {
            throw new StoreUnavailableException("Metadata store not found: " + dbFile);
        }
        return connect();
    }

    /**
     * Returns the negotiated schema, negotiating on first use. A failed negotiation is not
     * cached, so the next call tries again.
     */
    public StoreSchema schema() {
        StoreSchema current = schema;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (schema == null) {
                schema = negotiateSchema();
            }
            return schema;
        }
    }

    StoreSchema negotiateSchema() {
        try (Connection conn = openConnection()) {
            StoreSchema negotiated = StoreSchema.negotiate(
                    columnsOf(conn, StoreSchema.STATS_TABLE),
                    columnsOf(conn, StoreSchema.ARTIFACTS_TABLE)
            );
            log.info("Metadata store schema negotiated: {}", negotiated);
            return negotiated;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read metadata store schema: " + dbFile, e);
        }
    }

    /**
     * Creates the metadata tables when absent. Used by {@code init} and tests; the image-serving
     * application normally owns this schema.
     */
    public void initSchema() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create metadata store directory for " + dbFile, e);
        }
        try (Connection conn = connect(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS image_stats (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        camera_name TEXT NOT NULL,
                        filename TEXT NOT NULL,
                        total_views INTEGER DEFAULT 0,
                        unique_viewers INTEGER DEFAULT 0,
                        first_viewed_at DATETIME,
                        last_viewed_at DATETIME,
                        created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
                        updated_at DATETIME DEFAULT CURRENT_TIMESTAMP,
                        archived_path TEXT,
                        UNIQUE(camera_name, filename)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS saved_crops (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        original_camera TEXT NOT NULL,
                        original_filename TEXT NOT NULL,
                        original_path TEXT,
                        crop_filename TEXT NOT NULL,
                        crop_folder TEXT NOT NULL,
                        saved_at DATETIME DEFAULT CURRENT_TIMESTAMP
                    )
                    """);
            ensureStatsColumns(conn);
            st.execute("CREATE INDEX IF NOT EXISTS idx_image_stats_filename ON image_stats(filename)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_saved_crops_original ON saved_crops(original_filename)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize metadata store schema", e);
        }
        schema = null;
    }

    private void ensureStatsColumns(Connection conn) throws SQLException {
        Set<String> columns = columnsOf(conn, StoreSchema.STATS_TABLE);
        if (!columns.contains("archived_path") && !columns.contains("archive_path")) {
            try (Statement st = conn.createStatement()) {
                st.execute("ALTER TABLE image_stats ADD COLUMN archived_path TEXT");
            }
            log.info("Added archived_path column to image_stats");
        }
    }

    private Connection connect() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Long.toString(busyTimeoutMs));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private static Set<String> columnsOf(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }
}
