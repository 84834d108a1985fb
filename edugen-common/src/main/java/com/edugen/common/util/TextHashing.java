package com.edugen.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 helpers for cache keys and audit records.
 */
public final class TextHashing {
    
    private TextHashing() {}
    
    public static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
    
    /**
     * First {@code length} hex characters of the SHA-256 digest.
     */
    public static String shortHash(String text, int length) {
        String hex = sha256Hex(text);
        return hex.substring(0, Math.min(length, hex.length()));
    }
    
    /**
     * Lower-cases, trims and collapses whitespace so that trivially different
     * inputs share one key.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
            .replaceAll("\\s+", " ")
            .trim();
    }
}
