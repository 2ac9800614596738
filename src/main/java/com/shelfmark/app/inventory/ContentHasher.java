package com.shelfmark.app.inventory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.shelfmark.app.config.Config;

/**
 * Streams content through SHA-256 and returns the digest as lowercase hex.
 * Memory stays bounded by the buffer size whatever the file size.
 */
public class ContentHasher {

    public static final String ALGORITHM = "SHA-256";

    private final int bufferSize;

    public ContentHasher() {
        this(Config.getHashBufferSize());
    }

    public ContentHasher(int bufferSize) {
        if (bufferSize <= 0) throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        this.bufferSize = bufferSize;
    }

    public String hash(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return hash(in);
        }
    }

    public String hash(InputStream in) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("Digest algorithm unavailable: " + ALGORITHM, e);
        }
        byte[] buffer = new byte[bufferSize];
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
