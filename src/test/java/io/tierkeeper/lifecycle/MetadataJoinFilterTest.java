package io.tierkeeper.lifecycle;

import io.tierkeeper.model.FileRecord;
import io.tierkeeper.model.Rule;
import io.tierkeeper.storage.Database;
import io.tierkeeper.storage.MetadataStore;
import io.tierkeeper.testutil.MutableClock;
import io.tierkeeper.testutil.TestFiles;
import io.tierkeeper.testutil.TestStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class MetadataJoinFilterTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void matchesFullConjunctionAndReportsAggregatesSeparately() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-filter-");
        try {
            Database db = TestStore.create(root.resolve("traffic_cameras.db"));
            TestStore.addStats(db, "cam1", "viewed.jpg", 5);
            TestStore.addStats(db, "cam1", "cropped.jpg", 9);
            TestStore.addCrop(db, "cam1", "cropped.jpg");
            TestStore.addStats(db, "cam1", "unpopular.jpg", 1);

            MetadataJoinFilter filter = new MetadataJoinFilter(new MetadataStore(db), new MutableClock(NOW));
            Rule rule = new Rule("viewed, no crops", 6d, 2L, 0L);
            List<FileRecord> candidates = List.of(
                    record(root, "viewed.jpg", 10),
                    record(root, "cropped.jpg", 10),
                    record(root, "unpopular.jpg", 10),
                    record(root, "untracked.jpg", 10)
            );

            FilterResult result = filter.filter(candidates, rule);

            Assertions.assertTrue(result.storeAvailable());
            Assertions.assertEquals(1, result.matched().size());
            Assertions.assertEquals("viewed.jpg", result.matched().get(0).filename());
            Assertions.assertEquals(4, result.candidates());
            Assertions.assertEquals(3, result.trackedInStore());
            Assertions.assertEquals(2, result.meetingViewThreshold());
            Assertions.assertEquals(1, result.withCrops());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void untrackedFilesCountAsNeverViewedAndNeverCropped() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-filter-untracked-");
        try {
            Database db = TestStore.create(root.resolve("traffic_cameras.db"));
            MetadataJoinFilter filter = new MetadataJoinFilter(new MetadataStore(db), new MutableClock(NOW));

            FilterResult zeroViews = filter.filter(List.of(record(root, "new.jpg", 8)), new Rule("any", 6d, 0L, 0L));
            FilterResult needsViews = filter.filter(List.of(record(root, "new.jpg", 8)), new Rule("viewed", 6d, 1L, 0L));

            Assertions.assertEquals(1, zeroViews.matched().size());
            Assertions.assertEquals(0, zeroViews.trackedInStore());
            Assertions.assertTrue(needsViews.matched().isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void duplicateCandidatesAreMatchedOnce() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-filter-dup-");
        try {
            Database db = TestStore.create(root.resolve("traffic_cameras.db"));
            MetadataJoinFilter filter = new MetadataJoinFilter(new MetadataStore(db), new MutableClock(NOW));
            FileRecord file = record(root, "a.jpg", 12);

            FilterResult result = filter.filter(List.of(file, file), new Rule("any", 6d, 0L, 0L));

            Assertions.assertEquals(1, result.matched().size());
            Assertions.assertEquals(1, result.candidates());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unavailableStoreAbortsRuleWithEmptyResult() throws Exception {
        Path root = Files.createTempDirectory("tierkeeper-filter-down-");
        try {
            MetadataStore store = new MetadataStore(new Database(root.resolve("missing.db"), 100L));
            MetadataJoinFilter filter = new MetadataJoinFilter(store, new MutableClock(NOW));

            FilterResult result = filter.filter(List.of(record(root, "a.jpg", 12)), new Rule("any", 6d, 0L, 0L));

            Assertions.assertFalse(result.storeAvailable());
            Assertions.assertTrue(result.matched().isEmpty());
            Assertions.assertEquals(0, result.trackedInStore());
            Assertions.assertEquals(0, result.meetingViewThreshold());
            Assertions.assertEquals(0, result.withCrops());
            Assertions.assertNotNull(result.error());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static FileRecord record(Path root, String name, int ageHours) {
        return new FileRecord(root.resolve("cam1").resolve(name), 100L, NOW.minus(Duration.ofHours(ageHours)));
    }
}
