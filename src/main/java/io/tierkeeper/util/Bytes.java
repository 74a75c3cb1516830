package io.tierkeeper.util;

import java.util.Locale;

public final class Bytes {
    public static final long KIB = 1024L;
    public static final long MIB = KIB * 1024L;
    public static final long GIB = MIB * 1024L;

    private Bytes() {
    }

    public static String format(long sizeBytes) {
        if (sizeBytes < KIB) {
            return sizeBytes + " B";
        }
        if (sizeBytes < MIB) {
            return String.format(Locale.ROOT, "%.2f KB", sizeBytes / (double) KIB);
        }
        if (sizeBytes < GIB) {
            return String.format(Locale.ROOT, "%.2f MB", sizeBytes / (double) MIB);
        }
        return String.format(Locale.ROOT, "%.2f GB", sizeBytes / (double) GIB);
    }
}
