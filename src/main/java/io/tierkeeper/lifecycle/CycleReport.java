package io.tierkeeper.lifecycle;

import java.time.Instant;
import java.util.List;

public record CycleReport(
        Instant startedAt,
        Instant finishedAt,
        boolean dryRun,
        EvictionReport eviction,
        List<RuleReport> rules,
        boolean interrupted
) {
    public CycleReport {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public int filesMoved() {
        int total = 0;
        for (RuleReport rule : rules) {
            total += rule.migration().moved();
        }
        return total;
    }

    public int filesPurged() {
        int total = 0;
        for (RuleReport rule : rules) {
            total += rule.migration().purged();
        }
        return total;
    }
}
