package io.tierkeeper.model;

import java.time.Duration;

/**
 * Retention rule for hot-tier images.
 *
 * <p>A file matches when it is at least {@code ageHours} old, has been viewed at least
 * {@code minViews} times and has no more than {@code maxCrops} saved crops. A file is
 * migrated when it matches any configured rule.
 */
public record Rule(String description, double ageHours, long minViews, long maxCrops) {

    public boolean matches(double fileAgeHours, long views, long crops) {
        return fileAgeHours >= ageHours && views >= minViews && crops <= maxCrops;
    }

    public Duration minAge() {
        return Duration.ofMillis(Math.round(ageHours * 3_600_000d));
    }

    public boolean isValid() {
        return ageHours >= 0d && !Double.isNaN(ageHours) && minViews >= 0L && maxCrops >= 0L;
    }

    public String label() {
        return description == null || description.isBlank() ? "No description" : description;
    }
}
