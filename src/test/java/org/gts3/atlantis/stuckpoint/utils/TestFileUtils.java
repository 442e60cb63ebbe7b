package org.gts3.atlantis.stuckpoint.utils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestFileUtils {

    @TempDir
    Path tempDir;

    @Test
    public void testWritesAndReplacesFile() throws Exception {
        Path target = tempDir.resolve("out").resolve("report.json");

        FileUtils.writeStringAtomically(target, "first");
        FileUtils.writeStringAtomically(target, "second");

        assertEquals("second", Files.readString(target));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(1, files.count(), "temporary files must not be left behind");
        }
    }
}
