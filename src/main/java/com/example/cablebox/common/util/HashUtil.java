package com.example.cablebox.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtil {

    private static final double UNIT_SCALE = 0x1.0p-53;

    private HashUtil() {
    }

    public static String md5Hex(String text) {
        byte[] bytes = md5(text);
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Map a text key to a stable value in [0, 1). Same key, same value, on
     * every JVM; used wherever a seed must replace a random draw.
     */
    public static double unitInterval(String key) {
        byte[] bytes = md5(key);
        long bits = 0L;
        for (int i = 0; i < 8; i++) {
            bits = (bits << 8) | (bytes[i] & 0xFFL);
        }
        return (bits >>> 11) * UNIT_SCALE;
    }

    private static byte[] md5(String text) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("MD5");
            return messageDigest.digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }
}
