package io.github.c2port.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class FileUtil {
    private static final Logger logger = LogManager.getLogger(FileUtil.class);

    private FileUtil() {
        /* utility class – no instances */
    }

    /**
     * Deletes {@code path} and everything beneath it. Does **not** follow symlinks; logs but ignores individual delete
     * failures. Meant for cleanup paths that must not themselves throw.
     */
    public static boolean deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return false;
        }

        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    logger.warn("Failed to delete {}", p, e);
                }
            });
            return !Files.exists(path);
        } catch (IOException e) {
            logger.error("Failed to walk or initiate deletion for directory: {}", path, e);
            return false;
        }
    }

    /** Deletes {@code path} and everything beneath it, failing on the first entry that cannot be removed. */
    public static void deleteTree(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(path)) {
            entries = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : entries) {
            Files.delete(p);
        }
    }

    /** True if the file is missing or holds nothing but whitespace. */
    public static boolean isBlank(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            return true;
        }
        return readStringLossy(path).isBlank();
    }

    /** Reads a file as UTF-8, replacing malformed sequences instead of failing. */
    public static String readStringLossy(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }
}
