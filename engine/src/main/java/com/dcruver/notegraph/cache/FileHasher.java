package com.dcruver.notegraph.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Computes the file fingerprints the incremental cache validates against:
 * modification time (cheap) and a truncated SHA-256 of the content (expensive).
 */
public class FileHasher {

    /** Hex characters kept from the SHA-256 digest. */
    public static final int HASH_LENGTH = 16;

    /**
     * Current modification time of a file.
     *
     * @throws IOException if the file is missing or cannot be stat'ed
     */
    public Instant lastModified(Path file) throws IOException {
        return Files.getLastModifiedTime(file).toInstant();
    }

    /**
     * First {@value #HASH_LENGTH} hex characters of the SHA-256 of the file content.
     *
     * @throws IOException if the file cannot be read
     */
    public String hash(Path file) throws IOException {
        return hash(Files.readAllBytes(file));
    }

    /**
     * Same digest over bytes already in memory.
     */
    public static String hash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content)).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
