package io.github.c2port.analyzer;

import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Hex MD5 of a unit's raw bytes: the cache key of its sidecar and the seed of its aliases. */
public final class ContentHash {
    private ContentHash() {}

    public static String of(byte[] content) {
        try {
            var digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException(e);
        }
    }

    public static String of(Path file) throws IoFailureException {
        try {
            return of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new IoFailureException(file, e);
        }
    }
}
