package io.tierkeeper.config;

import io.tierkeeper.model.Rule;
import io.tierkeeper.util.Bytes;
import io.tierkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolved lifecycle settings.
 *
 * <p>Read from {@code tierkeeper-settings.json} under the data root. Every field is optional;
 * absent or out-of-range values fall back to the defaults below.
 */
public record LifecycleSettings(
        Path hotRoot,
        Path archiveRoot,
        String archiveNamespace,
        Path metadataDb,
        long cycleIntervalMs,
        long failureBackoffMs,
        boolean checkArchiveSpace,
        long archiveTargetFreeBytes,
        long archiveMaxCleanupBytes,
        int evictionScanLimit,
        long movePacingMs,
        long deletePacingMs,
        long storeBusyTimeoutMs,
        boolean dryRun,
        List<Rule> rules
) {
    private static final Logger log = LoggerFactory.getLogger(LifecycleSettings.class);

    public static final String DEFAULT_ARCHIVE_NAMESPACE = "archived";
    public static final long DEFAULT_CYCLE_INTERVAL_MS = Duration.ofHours(3).toMillis();
    public static final long DEFAULT_FAILURE_BACKOFF_MS = Duration.ofMinutes(1).toMillis();
    public static final long DEFAULT_TARGET_FREE_BYTES = 5L * Bytes.GIB;
    public static final long DEFAULT_MAX_CLEANUP_BYTES = 10L * Bytes.GIB;
    public static final int DEFAULT_EVICTION_SCAN_LIMIT = 1000;
    public static final long DEFAULT_MOVE_PACING_MS = 100L;
    public static final long DEFAULT_DELETE_PACING_MS = 50L;
    public static final long DEFAULT_STORE_BUSY_TIMEOUT_MS = 10_000L;

    public LifecycleSettings {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static LifecycleSettings defaults(TierKeeperConfig config) {
        return new LifecycleSettings(
                config.resolve(null, TierKeeperConfig.DEFAULT_HOT_DIR),
                config.resolve(null, TierKeeperConfig.DEFAULT_ARCHIVE_DIR),
                DEFAULT_ARCHIVE_NAMESPACE,
                config.resolve(null, TierKeeperConfig.DEFAULT_DB_FILE),
                DEFAULT_CYCLE_INTERVAL_MS,
                DEFAULT_FAILURE_BACKOFF_MS,
                true,
                DEFAULT_TARGET_FREE_BYTES,
                DEFAULT_MAX_CLEANUP_BYTES,
                DEFAULT_EVICTION_SCAN_LIMIT,
                DEFAULT_MOVE_PACING_MS,
                DEFAULT_DELETE_PACING_MS,
                DEFAULT_STORE_BUSY_TIMEOUT_MS,
                true,
                List.of(new Rule("Older than 6h, no crops", 6d, 0L, 0L))
        );
    }

    public static LifecycleSettings load(TierKeeperConfig config) {
        LifecycleSettings defaults = defaults(config);
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(config, raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load lifecycle settings: " + file, e);
        }
    }

    public LifecycleSettings withDryRun(boolean value) {
        if (value == dryRun) {
            return this;
        }
        return new LifecycleSettings(
                hotRoot,
                archiveRoot,
                archiveNamespace,
                metadataDb,
                cycleIntervalMs,
                failureBackoffMs,
                checkArchiveSpace,
                archiveTargetFreeBytes,
                archiveMaxCleanupBytes,
                evictionScanLimit,
                movePacingMs,
                deletePacingMs,
                storeBusyTimeoutMs,
                value,
                rules
        );
    }

    public Path archiveDir() {
        return archiveRoot.resolve(archiveNamespace);
    }

    static LifecycleSettings fromFile(TierKeeperConfig config, SettingsFile file, LifecycleSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new LifecycleSettings(
                file.hotRoot() == null ? defaults.hotRoot() : config.resolve(file.hotRoot(), TierKeeperConfig.DEFAULT_HOT_DIR),
                file.archiveRoot() == null ? defaults.archiveRoot() : config.resolve(file.archiveRoot(), TierKeeperConfig.DEFAULT_ARCHIVE_DIR),
                sanitizeSegment(file.archiveNamespace(), defaults.archiveNamespace()),
                file.metadataDb() == null ? defaults.metadataDb() : config.resolve(file.metadataDb(), TierKeeperConfig.DEFAULT_DB_FILE),
                sanitizeLong(file.cycleIntervalMs(), defaults.cycleIntervalMs(), 1_000L),
                sanitizeLong(file.failureBackoffMs(), defaults.failureBackoffMs(), 0L),
                sanitizeBoolean(file.checkArchiveSpace(), defaults.checkArchiveSpace()),
                sanitizeLong(file.archiveTargetFreeBytes(), defaults.archiveTargetFreeBytes(), 0L),
                sanitizeLong(file.archiveMaxCleanupBytes(), defaults.archiveMaxCleanupBytes(), 0L),
                sanitizeInt(file.evictionScanLimit(), defaults.evictionScanLimit(), 1),
                sanitizeLong(file.movePacingMs(), defaults.movePacingMs(), 0L),
                sanitizeLong(file.deletePacingMs(), defaults.deletePacingMs(), 0L),
                sanitizeLong(file.storeBusyTimeoutMs(), defaults.storeBusyTimeoutMs(), 0L),
                sanitizeBoolean(file.dryRun(), defaults.dryRun()),
                file.rules() == null ? defaults.rules() : resolveRules(file.rules())
        );
    }

    private static List<Rule> resolveRules(List<RuleSpec> specs) {
        List<Rule> out = new ArrayList<>();
        for (RuleSpec spec : specs) {
            if (spec == null || spec.ageHours() == null) {
                log.warn("Skipping lifecycle rule without ageHours: {}", spec);
                continue;
            }
            Rule rule = new Rule(
                    spec.description(),
                    spec.ageHours(),
                    spec.minViews() == null ? 0L : spec.minViews(),
                    spec.maxCrops() == null ? 0L : spec.maxCrops()
            );
            if (!rule.isValid()) {
                log.warn("Skipping invalid lifecycle rule: {}", rule);
                continue;
            }
            out.add(rule);
        }
        return out;
    }

    private static String sanitizeSegment(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        if (value.contains("/") || value.contains("\\") || value.equals(".") || value.equals("..")) {
            log.warn("Ignoring archiveNamespace '{}'; it must be a single path segment", raw);
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String hotRoot,
            String archiveRoot,
            String archiveNamespace,
            String metadataDb,
            Long cycleIntervalMs,
            Long failureBackoffMs,
            Boolean checkArchiveSpace,
            Long archiveTargetFreeBytes,
            Long archiveMaxCleanupBytes,
            Integer evictionScanLimit,
            Long movePacingMs,
            Long deletePacingMs,
            Long storeBusyTimeoutMs,
            Boolean dryRun,
            List<RuleSpec> rules
    ) {
    }

    record RuleSpec(String description, Double ageHours, Long minViews, Long maxCrops) {
    }
}
