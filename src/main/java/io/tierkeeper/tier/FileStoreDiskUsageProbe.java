package io.tierkeeper.tier;

import io.tierkeeper.model.DiskUsage;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

final class FileStoreDiskUsageProbe implements DiskUsageProbe {

    @Override
    public DiskUsage probe(Path tierRoot) throws IOException {
        if (!Files.exists(tierRoot)) {
            throw new NoSuchFileException(tierRoot.toString(), null, "tier root not found");
        }
        FileStore store = Files.getFileStore(tierRoot);
        long total = store.getTotalSpace();
        long free = store.getUsableSpace();
        long used = Math.max(0L, total - store.getUnallocatedSpace());
        return new DiskUsage(total, used, free);
    }
}
