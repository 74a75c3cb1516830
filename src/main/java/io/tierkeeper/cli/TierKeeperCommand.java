package io.tierkeeper.cli;

import io.tierkeeper.config.TierKeeperConfig;
import io.tierkeeper.lifecycle.CycleReport;
import io.tierkeeper.lifecycle.EvictionReport;
import io.tierkeeper.lifecycle.IntegrityReport;
import io.tierkeeper.lifecycle.RuleReport;
import io.tierkeeper.runtime.TierKeeperRuntime;
import io.tierkeeper.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "tierkeeper",
        mixinStandardHelpOptions = true,
        description = "Hot/archive image tier lifecycle manager",
        subcommands = {
                TierKeeperCommand.InitCommand.class,
                TierKeeperCommand.CycleCommand.class,
                TierKeeperCommand.RunCommand.class,
                TierKeeperCommand.EvictCommand.class,
                TierKeeperCommand.MigrateCommand.class,
                TierKeeperCommand.DiskUsageCommand.class,
                TierKeeperCommand.IntegrityReportCommand.class,
                TierKeeperCommand.SettingsCommand.class
        }
)
public final class TierKeeperCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = TierKeeperConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | cycle | run | evict | migrate | disk-usage | integrity-report | settings");
    }

    TierKeeperRuntime runtime(boolean forceDryRun) {
        return new TierKeeperRuntime(TierKeeperConfig.fromRoot(root), forceDryRun);
    }

    @Command(name = "init", description = "Create tier directories and the metadata schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Override
        public Integer call() {
            TierKeeperRuntime.InitOutcome outcome = parent.runtime(false).init();
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "cycle", description = "Run one lifecycle cycle: evict, then every rule")
    static final class CycleCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Report without moving or deleting anything")
        boolean dryRun;

        @Override
        public Integer call() {
            CycleReport report = parent.runtime(dryRun).runCycle();
            System.out.println(Jsons.toJson(report));
            return report.interrupted() ? 130 : 0;
        }
    }

    @Command(name = "run", description = "Run lifecycle cycles at the configured interval until stopped")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Report without moving or deleting anything")
        boolean dryRun;

        @Override
        public Integer call() {
            TierKeeperRuntime runtime = parent.runtime(dryRun);
            AtomicBoolean running = new AtomicBoolean(true);
            CountDownLatch stopped = new CountDownLatch(1);
            Thread loopThread = Thread.currentThread();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                loopThread.interrupt();
                try {
                    // Let the executor finish purges and metadata writes for files already touched.
                    stopped.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "tierkeeper-shutdown-hook"));

            int cycles;
            try {
                cycles = runtime.runLoop(running::get);
            } finally {
                stopped.countDown();
            }
            System.out.println(Jsons.toJson(Map.of("cycles", cycles)));
            return 0;
        }
    }

    @Command(name = "evict", description = "Run archive eviction only")
    static final class EvictCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Plan eviction without deleting")
        boolean dryRun;

        @Override
        public Integer call() {
            EvictionReport report = parent.runtime(dryRun).evict();
            System.out.println(Jsons.toJson(report));
            return report.status() == EvictionReport.Status.PROBE_FAILED ? 2 : 0;
        }
    }

    @Command(name = "migrate", description = "Run scan, filter and migrate for a single rule")
    static final class MigrateCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Option(names = {"--rule"}, defaultValue = "0", description = "Zero-based rule index")
        int rule;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Report without moving or deleting anything")
        boolean dryRun;

        @Override
        public Integer call() {
            RuleReport report = parent.runtime(dryRun).migrate(rule);
            System.out.println(Jsons.toJson(report));
            return report.filter().storeAvailable() ? 0 : 2;
        }
    }

    @Command(name = "disk-usage", description = "Show capacity of a tier filesystem")
    static final class DiskUsageCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Option(names = {"--tier"}, defaultValue = "archive", description = "Tier: hot|archive")
        String tier;

        @Override
        public Integer call() {
            TierKeeperRuntime.DiskUsageOutcome outcome = parent.runtime(false).diskUsage(tier);
            System.out.println(Jsons.toJson(outcome));
            return outcome.available() ? 0 : 2;
        }
    }

    @Command(name = "integrity-report", description = "Compare metadata rows with files on both tiers (read-only)")
    static final class IntegrityReportCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Option(names = {"--sample"}, defaultValue = "20", description = "Max orphaned rows to list")
        int sample;

        @Override
        public Integer call() {
            IntegrityReport report = parent.runtime(false).integrityReport(sample);
            System.out.println(Jsons.toJson(report));
            return 0;
        }
    }

    @Command(name = "settings", description = "Print resolved lifecycle settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        TierKeeperCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime(false).settingsView()));
            return 0;
        }
    }
}
