package com.mainframe.analyzer.util;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;

/**
 * Writes scan artifacts (JSON model, Markdown pages) to disk.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        safeWriteString(filePath, content, StandardCharsets.UTF_8);
    }

    public static void safeWriteString(Path filePath, String content, Charset charset) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            ensureDirectory(parentDir);
        }
        Files.writeString(filePath, content, charset);
    }

    /**
     * Creates {@code dir} if missing.
     *
     * @throws NotDirectoryException if a regular file already sits at {@code dir}
     */
    public static Path ensureDirectory(Path dir) throws IOException {
        if (Files.exists(dir) && !Files.isDirectory(dir)) {
            throw new NotDirectoryException(dir.toString());
        }
        return Files.createDirectories(dir);
    }
}
