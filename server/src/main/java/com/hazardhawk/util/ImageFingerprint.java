package com.hazardhawk.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class ImageFingerprint {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /**
     * SHA-256 over the image bytes, a zero separator byte and the context tag, hex encoded.
     * The separator keeps image/context boundaries from shifting into each other.
     */
    public static String of(byte[] image, String context) {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }
        MessageDigest digest = sha256();
        digest.update(image);
        digest.update((byte) 0);
        if (context != null) {
            digest.update(context.getBytes(StandardCharsets.UTF_8));
        }
        return toHex(digest.digest());
    }

    public static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
