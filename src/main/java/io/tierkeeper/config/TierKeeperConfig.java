package io.tierkeeper.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TierKeeperConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "tierkeeper-settings.json";
    public static final String DEFAULT_HOT_DIR = "captured_images";
    public static final String DEFAULT_ARCHIVE_DIR = "archive";
    public static final String DEFAULT_DB_FILE = "traffic_cameras.db";

    private final Path rootDir;

    public TierKeeperConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TierKeeperConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root.trim());
        return new TierKeeperConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("lifecycle-audit.jsonl");
    }

    /**
     * Resolves a configured location; relative values are taken from the data root.
     */
    public Path resolve(String location, String fallback) {
        String value = location == null || location.isBlank() ? fallback : location.trim();
        Path path = Paths.get(value);
        if (!path.isAbsolute()) {
            path = rootDir.resolve(path);
        }
        return path.toAbsolutePath().normalize();
    }
}
