package io.tierkeeper.lifecycle;

/**
 * Scan, filter and migration outcome of one rule within a cycle.
 */
public record RuleReport(
        int index,
        String rule,
        int candidates,
        FilterResult filter,
        MigrationReport migration
) {
}
