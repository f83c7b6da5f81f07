package com.convexlab.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes result files so that readers never see a partially written file.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a sibling temporary file, then moves it over {@code filePath}.
     * Parent directories are created as needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parentDir = target.getParent();
        Files.createDirectories(parentDir);
        Path temp = Files.createTempFile(parentDir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public static void safeWriteLines(Path filePath, List<String> lines) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        safeWriteString(filePath, sb.toString());
    }
}
