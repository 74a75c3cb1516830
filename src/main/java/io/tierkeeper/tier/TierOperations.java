package io.tierkeeper.tier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem mutations performed on tier files, separated so failures can be simulated in tests.
 *
 * <p>Both operations throw {@link NoSuchFileException} when the source is already gone.
 */
public interface TierOperations {
    void move(Path source, Path target) throws IOException;

    void delete(Path path) throws IOException;

    static TierOperations local() {
        return new TierOperations() {
            @Override
            public void move(Path source, Path target) throws IOException {
                if (!Files.exists(source)) {
                    throw new NoSuchFileException(source.toString());
                }
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }

            @Override
            public void delete(Path path) throws IOException {
                Files.delete(path);
            }
        };
    }
}
