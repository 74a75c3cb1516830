package io.tierkeeper.model;

public record MigrationResult(
        String source,
        String destination,
        long sizeBytes,
        MigrationStatus status,
        String detail
) {
}
