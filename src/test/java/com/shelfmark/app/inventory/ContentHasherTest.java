package com.shelfmark.app.inventory;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ContentHasherTest {

    @Test
    void hashMatchesKnownSha256Vectors() throws Exception {
        ContentHasher hasher = new ContentHasher();

        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                hasher.hash(new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8))));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                hasher.hash(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    void sameContentSameSignature_differentContentDifferentSignature() throws Exception {
        Path dir = Files.createTempDirectory("shelfmark-hash-");
        Path a = dir.resolve("a.txt");
        Path b = dir.resolve("b.txt");
        Path c = dir.resolve("c.txt");
        Files.writeString(a, "same", StandardCharsets.UTF_8);
        Files.writeString(b, "same", StandardCharsets.UTF_8);
        Files.writeString(c, "other", StandardCharsets.UTF_8);

        ContentHasher hasher = new ContentHasher();
        String ha = hasher.hash(a);

        assertEquals(64, ha.length(), "SHA-256 hex should be 64 chars");
        assertEquals(ha.toLowerCase(), ha, "Signature must be lowercase hex");
        assertEquals(ha, hasher.hash(b));
        assertNotEquals(ha, hasher.hash(c));
    }

    @Test
    void bufferSizeDoesNotChangeSignature() throws Exception {
        byte[] content = new byte[10_000];
        Arrays.fill(content, (byte) 'x');
        content[9_999] = 'y';

        String small = new ContentHasher(7).hash(new ByteArrayInputStream(content));
        String large = new ContentHasher(64 * 1024).hash(new ByteArrayInputStream(content));

        assertEquals(large, small);
    }

    @Test
    void missingFileThrows() throws Exception {
        Path dir = Files.createTempDirectory("shelfmark-hash-");
        assertThrows(IOException.class, () -> new ContentHasher().hash(dir.resolve("absent.bin")));
    }

    @Test
    void rejectsNonPositiveBuffer() {
        assertThrows(IllegalArgumentException.class, () -> new ContentHasher(0));
    }
}
