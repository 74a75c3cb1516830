package io.tierkeeper.runtime;

import io.tierkeeper.config.LifecycleSettings;
import io.tierkeeper.config.TierKeeperConfig;
import io.tierkeeper.lifecycle.ArchiveEvictor;
import io.tierkeeper.lifecycle.CycleReport;
import io.tierkeeper.lifecycle.EvictionPolicy;
import io.tierkeeper.lifecycle.EvictionReport;
import io.tierkeeper.lifecycle.IntegrityReport;
import io.tierkeeper.lifecycle.IntegrityScanner;
import io.tierkeeper.lifecycle.LifecycleScheduler;
import io.tierkeeper.lifecycle.MetadataJoinFilter;
import io.tierkeeper.lifecycle.MigrationExecutor;
import io.tierkeeper.lifecycle.RuleReport;
import io.tierkeeper.model.DiskUsage;
import io.tierkeeper.model.Rule;
import io.tierkeeper.observability.AuditLogger;
import io.tierkeeper.storage.Database;
import io.tierkeeper.storage.MetadataStore;
import io.tierkeeper.tier.CandidateScanner;
import io.tierkeeper.tier.DiskUsageProbe;
import io.tierkeeper.tier.Pacer;
import io.tierkeeper.tier.Sleeper;
import io.tierkeeper.tier.TierOperations;
import io.tierkeeper.util.Bytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;

public final class TierKeeperRuntime {
    private static final Logger log = LoggerFactory.getLogger(TierKeeperRuntime.class);

    private final TierKeeperConfig config;
    private final LifecycleSettings settings;
    private final DiskUsageProbe probe;
    private final Database database;
    private final MetadataStore store;
    private final AuditLogger auditLogger;
    private final CandidateScanner scanner;
    private final LifecycleScheduler scheduler;
    private final IntegrityScanner integrityScanner;

    public TierKeeperRuntime(TierKeeperConfig config) {
        this(config, false);
    }

    /**
     * @param forceDryRun run in dry-run mode regardless of the settings file
     */
    public TierKeeperRuntime(TierKeeperConfig config, boolean forceDryRun) {
        this(
                config,
                forceDryRun ? LifecycleSettings.load(config).withDryRun(true) : LifecycleSettings.load(config),
                DiskUsageProbe.fileStore(),
                TierOperations.local(),
                Clock.systemUTC(),
                Sleeper.system()
        );
    }

    TierKeeperRuntime(
            TierKeeperConfig config,
            LifecycleSettings settings,
            DiskUsageProbe probe,
            TierOperations ops,
            Clock clock,
            Sleeper sleeper
    ) {
        this.config = config;
        this.settings = settings;
        this.probe = probe;
        this.database = new Database(settings.metadataDb(), settings.storeBusyTimeoutMs());
        this.store = new MetadataStore(database);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.scanner = new CandidateScanner(clock);

        MetadataJoinFilter filter = new MetadataJoinFilter(store, clock);
        MigrationExecutor executor = new MigrationExecutor(
                settings.hotRoot(),
                settings.archiveRoot(),
                settings.archiveNamespace(),
                store,
                ops,
                Pacer.fixed(Duration.ofMillis(settings.movePacingMs()), sleeper),
                auditLogger
        );
        ArchiveEvictor evictor = new ArchiveEvictor(
                probe,
                scanner,
                ops,
                Pacer.fixed(Duration.ofMillis(settings.deletePacingMs()), sleeper),
                auditLogger
        );
        LifecycleScheduler.Options options = new LifecycleScheduler.Options(
                settings.hotRoot(),
                settings.archiveRoot(),
                settings.archiveDir(),
                settings.rules(),
                settings.checkArchiveSpace(),
                new EvictionPolicy(
                        settings.archiveTargetFreeBytes(),
                        settings.archiveMaxCleanupBytes(),
                        settings.evictionScanLimit()
                ),
                Duration.ofMillis(settings.cycleIntervalMs()),
                Duration.ofMillis(settings.failureBackoffMs()),
                settings.dryRun()
        );
        this.scheduler = new LifecycleScheduler(options, scanner, filter, executor, evictor, auditLogger, clock, sleeper);
        this.integrityScanner = new IntegrityScanner(store, scanner);
    }

    public InitOutcome init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(settings.hotRoot());
            Files.createDirectories(settings.archiveDir());
            Path dbParent = settings.metadataDb().getParent();
            if (dbParent != null) {
                Files.createDirectories(dbParent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create tier directories", e);
        }
        database.initSchema();
        return new InitOutcome(
                config.rootDir().toString(),
                settings.hotRoot().toString(),
                settings.archiveDir().toString(),
                settings.metadataDb().toString()
        );
    }

    public LifecycleSettings settings() {
        return settings;
    }

    public SettingsView settingsView() {
        return new SettingsView(
                settings.hotRoot().toString(),
                settings.archiveRoot().toString(),
                settings.archiveNamespace(),
                settings.metadataDb().toString(),
                settings.cycleIntervalMs(),
                settings.failureBackoffMs(),
                settings.checkArchiveSpace(),
                settings.archiveTargetFreeBytes(),
                settings.archiveMaxCleanupBytes(),
                settings.evictionScanLimit(),
                settings.movePacingMs(),
                settings.deletePacingMs(),
                settings.storeBusyTimeoutMs(),
                settings.dryRun(),
                settings.rules(),
                config.settingsFile().toString(),
                Files.exists(config.settingsFile())
        );
    }

    public MetadataStore store() {
        return store;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public CycleReport runCycle() {
        announceMode();
        return scheduler.runCycle();
    }

    public int runLoop(BooleanSupplier keepRunning) {
        announceMode();
        return scheduler.runLoop(keepRunning);
    }

    public EvictionReport evict() {
        announceMode();
        return scheduler.runEviction();
    }

    /**
     * Runs scan, filter and migrate for one configured rule.
     *
     * @param ruleIndex zero-based position in the configured rule list
     */
    public RuleReport migrate(int ruleIndex) {
        List<Rule> rules = settings.rules();
        if (ruleIndex < 0 || ruleIndex >= rules.size()) {
            throw new IllegalArgumentException("rule index out of range: " + ruleIndex + " (configured rules: " + rules.size() + ")");
        }
        announceMode();
        return scheduler.runRule(ruleIndex);
    }

    public DiskUsageOutcome diskUsage(String tier) {
        String normalized = tier == null ? "archive" : tier.trim().toLowerCase(Locale.ROOT);
        Path root;
        if ("hot".equals(normalized)) {
            root = settings.hotRoot();
        } else if ("archive".equals(normalized)) {
            root = settings.archiveRoot();
        } else {
            throw new IllegalArgumentException("tier must be hot|archive");
        }
        DiskUsage usage;
        try {
            usage = probe.probe(root);
        } catch (IOException e) {
            log.warn("Disk usage probe failed for {}: {}", root, e.toString());
            usage = DiskUsage.unavailable();
        }
        return new DiskUsageOutcome(
                normalized,
                root.toString(),
                usage.available(),
                usage.totalBytes(),
                usage.usedBytes(),
                usage.freeBytes(),
                Math.round(usage.percentUsed() * 10d) / 10d,
                Bytes.format(usage.freeBytes())
        );
    }

    public IntegrityReport integrityReport(int sampleSize) {
        return integrityScanner.scan(settings.hotRoot(), Math.max(0, sampleSize));
    }

    private void announceMode() {
        if (settings.dryRun()) {
            log.info("DRY RUN mode: no files will be moved or deleted");
        } else {
            log.warn("LIVE mode: files will be moved, purged and evicted");
        }
    }

    public record InitOutcome(String root, String hotRoot, String archiveDir, String metadataDb) {
    }

    public record SettingsView(
            String hotRoot,
            String archiveRoot,
            String archiveNamespace,
            String metadataDb,
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
            List<Rule> rules,
            String settingsFile,
            boolean settingsFileExists
    ) {
    }

    public record DiskUsageOutcome(
            String tier,
            String root,
            boolean available,
            long totalBytes,
            long usedBytes,
            long freeBytes,
            double percentUsed,
            String freeHuman
    ) {
    }
}
