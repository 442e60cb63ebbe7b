package org.gts3.atlantis.stuckpoint.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_ERROR;

/**
 * File helpers for writing analysis results and cleaning up scratch directories.
 */
public class FileUtils {

    /**
     * Writes a string to {@code targetPath} so that readers never observe a half-written file.
     * The content goes to a hidden sibling file first, which is then moved over the target.
     *
     * @param targetPath The file to create or replace
     * @param content The UTF-8 content to write
     * @throws IOException If writing or moving the file fails
     */
    public static void writeStringAtomically(Path targetPath, String content) throws IOException {
        Path absoluteTarget = targetPath.toAbsolutePath();
        Path parent = absoluteTarget.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path tempFile = Files.createTempFile(parent, ".hidden." + absoluteTarget.getFileName(), "");
        try {
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);
            Files.move(tempFile, absoluteTarget, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupException) {
                System.err.println(LOG_ERROR + "Error cleaning up temporary file " + tempFile + ": " + cleanupException.getMessage());
            }
            throw e;
        }
    }

    /**
     * Deletes a directory tree. Failures are logged, not thrown, since callers use this for cleanup.
     */
    public static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            System.err.println(LOG_ERROR + "Error deleting " + root + ": " + e.getMessage());
        }
    }
}
