package io.tierkeeper.lifecycle;

import io.tierkeeper.model.FileRecord;
import io.tierkeeper.model.ImageStats;
import io.tierkeeper.model.Rule;
import io.tierkeeper.storage.MetadataStore;
import io.tierkeeper.storage.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies candidate files against a rule using view and crop counts from the metadata store.
 *
 * <p>Counts for all candidates are fetched in one batched lookup. Files the store does not know
 * are treated as never viewed and never cropped.
 */
public final class MetadataJoinFilter {
    private static final Logger log = LoggerFactory.getLogger(MetadataJoinFilter.class);

    private final MetadataStore store;
    private final Clock clock;

    public MetadataJoinFilter(MetadataStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public FilterResult filter(Collection<FileRecord> candidates, Rule rule) {
        if (candidates == null || candidates.isEmpty()) {
            return FilterResult.empty();
        }
        Map<String, FileRecord> unique = new LinkedHashMap<>();
        for (FileRecord candidate : candidates) {
            unique.putIfAbsent(candidate.path().toString(), candidate);
        }
        List<String> filenames = new ArrayList<>(unique.size());
        for (FileRecord candidate : unique.values()) {
            filenames.add(candidate.filename());
        }

        Map<String, ImageStats> stats;
        try {
            log.info("Querying metadata store for stats on {} files", filenames.size());
            stats = store.lookup(filenames);
        } catch (StoreUnavailableException e) {
            log.error("Metadata store unavailable; skipping rule '{}' this cycle: {}", rule.label(), e.getMessage(), e);
            return FilterResult.storeUnavailable(unique.size(), e.getMessage());
        }

        Instant now = clock.instant();
        List<FileRecord> matched = new ArrayList<>();
        int tracked = 0;
        int meetingViews = 0;
        int withCrops = 0;
        for (FileRecord candidate : unique.values()) {
            ImageStats row = stats.get(candidate.filename());
            if (row != null) {
                tracked++;
            } else {
                row = ImageStats.untracked(candidate.filename());
            }
            if (row.views() >= rule.minViews()) {
                meetingViews++;
            }
            if (row.crops() > 0L) {
                withCrops++;
            }
            if (rule.matches(candidate.ageHoursAt(now), row.views(), row.crops())) {
                matched.add(candidate);
            }
        }
        return new FilterResult(matched, unique.size(), tracked, meetingViews, withCrops, true, null);
    }
}
