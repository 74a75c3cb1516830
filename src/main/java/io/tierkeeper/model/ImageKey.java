package io.tierkeeper.model;

/**
 * Identity of one image row in the metadata store. {@code camera} is null when the source
 * directory of the file is unknown, in which case only the filename identifies the row.
 */
public record ImageKey(String camera, String filename) {

    public static ImageKey of(String camera, String filename) {
        return new ImageKey(camera == null || camera.isBlank() ? null : camera, filename);
    }

    public boolean hasCamera() {
        return camera != null;
    }
}
