package com.architecture.diagram.irengine.service.codec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Truncated SHA-256 of encoded diagram text, used by downstream consumers for change detection.
 */
public class ContentFingerprint {

    public static final int DEFAULT_LENGTH = 16;
    private static final int MAX_LENGTH = 64;

    private final int length;

    public ContentFingerprint() {
        this(DEFAULT_LENGTH);
    }

    public ContentFingerprint(int length) {
        if (length < 4 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("fingerprint length must be between 4 and " + MAX_LENGTH + ": " + length);
        }
        this.length = length;
    }

    public String of(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, length);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public int getLength() {
        return length;
    }
}
