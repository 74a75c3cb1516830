package io.tierkeeper.tier;

import io.tierkeeper.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive listing of regular files under a tier root.
 *
 * <p>Files or directories that vanish while the walk is in progress are skipped without error.
 */
public final class CandidateScanner {
    private static final Logger log = LoggerFactory.getLogger(CandidateScanner.class);

    private final Clock clock;

    public CandidateScanner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns files whose modification time is strictly before {@code now - minAge}.
     */
    public List<FileRecord> scan(Path root, Duration minAge) {
        Instant threshold = clock.instant().minus(minAge);
        log.info("Searching {} for files modified before {}", root, threshold);
        List<FileRecord> out = new ArrayList<>();
        for (FileRecord file : listFiles(root)) {
            if (file.modifiedAt().isBefore(threshold)) {
                out.add(file);
            }
        }
        return out;
    }

    public List<FileRecord> listFiles(Path root) {
        return listFiles(root, new Listing());
    }

    List<FileRecord> listFiles(Path root, Listing listing) {
        if (!Files.isDirectory(root)) {
            log.error("Tier directory not found at '{}'", root);
            return new ArrayList<>();
        }
        try {
            Files.walkFileTree(root, listing);
        } catch (IOException e) {
            log.warn("Failed to walk tier directory {}", root, e);
        }
        return listing.files();
    }

    /**
     * Collects regular files; paths that disappear between listing and stat are dropped.
     */
    static class Listing extends SimpleFileVisitor<Path> {
        private final List<FileRecord> files = new ArrayList<>();

        List<FileRecord> files() {
            return files;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                files.add(new FileRecord(file, attrs.size(), attrs.lastModifiedTime().toInstant()));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            if (!(e instanceof NoSuchFileException)) {
                log.warn("Skipping unreadable path {}: {}", file, e.toString());
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException e) {
            if (e != null && !(e instanceof NoSuchFileException)) {
                log.warn("Incomplete listing of {}: {}", dir, e.toString());
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
