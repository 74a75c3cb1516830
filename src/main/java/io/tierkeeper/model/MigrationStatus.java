package io.tierkeeper.model;

public enum MigrationStatus {
    PLANNED,
    MOVED,
    PURGED,
    SKIPPED_TRANSIENT,
    FAILED_FATAL
}
