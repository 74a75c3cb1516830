package io.tierkeeper.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class BytesTest {

    @Test
    void formatsWithBinaryUnits() {
        Assertions.assertEquals("512 B", Bytes.format(512L));
        Assertions.assertEquals("1.50 KB", Bytes.format(1536L));
        Assertions.assertEquals("2.00 MB", Bytes.format(2L * Bytes.MIB));
        Assertions.assertEquals("5.00 GB", Bytes.format(5L * Bytes.GIB));
    }
}
