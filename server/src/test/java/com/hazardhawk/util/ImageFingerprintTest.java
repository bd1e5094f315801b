package com.hazardhawk.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ImageFingerprintTest {

    @Test
    public void testSameInputSameFingerprint() {
        byte[] image = "jpeg-bytes".getBytes(StandardCharsets.UTF_8);
        assertEquals(ImageFingerprint.of(image, "ELECTRICAL"), ImageFingerprint.of(image.clone(), "ELECTRICAL"));
    }

    @Test
    public void testContextChangesFingerprint() {
        byte[] image = "jpeg-bytes".getBytes(StandardCharsets.UTF_8);
        assertNotEquals(ImageFingerprint.of(image, "ELECTRICAL"), ImageFingerprint.of(image, "ROOFING"));
    }

    @Test
    public void testSeparatorKeepsBoundary() {
        // "ab" + "c" must not collide with "a" + "bc"
        String first = ImageFingerprint.of("ab".getBytes(StandardCharsets.UTF_8), "c");
        String second = ImageFingerprint.of("a".getBytes(StandardCharsets.UTF_8), "bc");
        assertNotEquals(first, second);
    }

    @Test
    public void testHexEncoding() {
        String fingerprint = ImageFingerprint.of(new byte[] {1, 2, 3}, "GENERAL_CONSTRUCTION");
        assertEquals(64, fingerprint.length());
        assertTrue(fingerprint.matches("[0-9a-f]+"));
        assertEquals("00ff7f", ImageFingerprint.toHex(new byte[] {0, (byte) 0xFF, 0x7F}));
    }

    @Test
    public void testNullImageRejected() {
        assertThrows(IllegalArgumentException.class, () -> ImageFingerprint.of(null, "ROOFING"));
    }
}
