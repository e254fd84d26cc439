package com.resource.lock.postgres;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Default {@link AdvisoryKeyHasher}: SHA-256 of the UTF-8 key, first 8 bytes
 * read as a big-endian signed {@code long}.
 */
public final class Sha256AdvisoryKeyHasher implements AdvisoryKeyHasher {

    public static final Sha256AdvisoryKeyHasher INSTANCE = new Sha256AdvisoryKeyHasher();

    private Sha256AdvisoryKeyHasher() {
    }

    @Override
    public long hash(String key) {
        byte[] digest = sha256().digest(key.getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
