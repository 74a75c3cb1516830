package io.tierkeeper.lifecycle;

import io.tierkeeper.model.FileRecord;
import io.tierkeeper.model.Rule;
import io.tierkeeper.observability.AuditLogger;
import io.tierkeeper.tier.CandidateScanner;
import io.tierkeeper.tier.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Runs lifecycle cycles at a fixed interval: archive eviction first, then each rule's
 * scan, filter and migrate pipeline in configured order.
 *
 * <p>A failing cycle is logged and retried after a backoff. The loop ends only when the
 * supplied condition turns false or the thread is interrupted.
 */
public final class LifecycleScheduler {
    private static final Logger log = LoggerFactory.getLogger(LifecycleScheduler.class);

    private final Options options;
    private final CandidateScanner scanner;
    private final MetadataJoinFilter filter;
    private final MigrationExecutor executor;
    private final ArchiveEvictor evictor;
    private final AuditLogger audit;
    private final Clock clock;
    private final Sleeper sleeper;

    public LifecycleScheduler(
            Options options,
            CandidateScanner scanner,
            MetadataJoinFilter filter,
            MigrationExecutor executor,
            ArchiveEvictor evictor,
            AuditLogger audit,
            Clock clock,
            Sleeper sleeper
    ) {
        this.options = options;
        this.scanner = scanner;
        this.filter = filter;
        this.executor = executor;
        this.evictor = evictor;
        this.audit = audit;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public Options options() {
        return options;
    }

    public CycleReport runCycle() {
        Instant startedAt = clock.instant();
        log.info("Starting lifecycle cycle{} with {} rules", options.dryRun() ? " [DRY RUN]" : "", options.rules().size());

        EvictionReport eviction = null;
        if (options.evictionEnabled()) {
            eviction = runEviction();
        }

        List<RuleReport> reports = new ArrayList<>();
        boolean interrupted = Thread.currentThread().isInterrupted();
        for (int i = 0; i < options.rules().size() && !interrupted; i++) {
            reports.add(runRule(i));
            interrupted = Thread.currentThread().isInterrupted();
        }

        CycleReport report = new CycleReport(startedAt, clock.instant(), options.dryRun(), eviction, reports, interrupted);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rules", reports.size());
        details.put("moved", report.filesMoved());
        details.put("purged", report.filesPurged());
        details.put("evicted", eviction == null ? 0 : eviction.deleted());
        audit.log(AuditLogger.AuditEvent.of("lifecycle.cycle", options.hotRoot().toString(),
                interrupted ? "interrupted" : "completed", options.dryRun(), details));
        log.info("Lifecycle cycle finished: moved={}, purged={}{}", report.filesMoved(), report.filesPurged(),
                interrupted ? " (interrupted)" : "");
        return report;
    }

    public EvictionReport runEviction() {
        return evictor.evict(options.archiveRoot(), options.archiveDir(), options.eviction(), options.dryRun());
    }

    public RuleReport runRule(int index) {
        Rule rule = options.rules().get(index);
        log.info("Rule {}: {} (age >= {}h, views >= {}, crops <= {})", index + 1, rule.label(),
                rule.ageHours(), rule.minViews(), rule.maxCrops());
        List<FileRecord> candidates = scanner.scan(options.hotRoot(), rule.minAge());
        FilterResult filtered = filter.filter(candidates, rule);
        if (filtered.storeAvailable()) {
            log.info("Rule {}: {} candidates, {} tracked, {} meet view threshold, {} with crops, {} match",
                    index + 1, filtered.candidates(), filtered.trackedInStore(), filtered.meetingViewThreshold(),
                    filtered.withCrops(), filtered.matched().size());
        }
        MigrationReport migration = executor.migrate(filtered.matched(), options.dryRun());
        return new RuleReport(index, rule.label(), candidates.size(), filtered, migration);
    }

    /**
     * @return number of cycles that completed without an unexpected failure
     */
    public int runLoop(BooleanSupplier keepRunning) {
        Duration interval = options.cycleInterval();
        int completed = 0;
        log.info("Lifecycle scheduler started; interval {}s", interval.toSeconds());
        while (keepRunning.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
            Instant start = clock.instant();
            try {
                CycleReport report = runCycle();
                if (report.interrupted()) {
                    break;
                }
                completed++;
            } catch (RuntimeException e) {
                log.error("Lifecycle cycle failed; retrying in {} ms", options.failureBackoff().toMillis(), e);
                if (!sleep(options.failureBackoff())) {
                    break;
                }
                continue;
            }
            Duration elapsed = Duration.between(start, clock.instant());
            Duration remaining = interval.minus(elapsed);
            if (remaining.isNegative() || remaining.isZero()) {
                log.warn("Lifecycle cycle took {}s, longer than the {}s interval; starting next cycle now",
                        elapsed.toSeconds(), interval.toSeconds());
                continue;
            }
            log.info("Next lifecycle cycle in {}s", remaining.toSeconds());
            if (!sleep(remaining)) {
                break;
            }
        }
        log.info("Lifecycle scheduler stopped after {} cycles", completed);
        return completed;
    }

    private boolean sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public record Options(
            Path hotRoot,
            Path archiveRoot,
            Path archiveDir,
            List<Rule> rules,
            boolean evictionEnabled,
            EvictionPolicy eviction,
            Duration cycleInterval,
            Duration failureBackoff,
            boolean dryRun
    ) {
        public Options {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }
}
