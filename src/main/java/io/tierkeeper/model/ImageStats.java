package io.tierkeeper.model;

/**
 * Usage counters for one image as recorded in the metadata store.
 */
public record ImageStats(String filename, long views, long crops) {

    public static ImageStats untracked(String filename) {
        return new ImageStats(filename, 0L, 0L);
    }
}
