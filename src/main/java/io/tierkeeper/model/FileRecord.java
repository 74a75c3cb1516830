package io.tierkeeper.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

public record FileRecord(Path path, long sizeBytes, Instant modifiedAt) {

    public String filename() {
        return path.getFileName().toString();
    }

    public double ageHoursAt(Instant now) {
        return Duration.between(modifiedAt, now).toMillis() / 3_600_000d;
    }
}
