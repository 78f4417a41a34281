package com.example.seasonroster.schedule;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic tiebreak value derived from the caller's reroll token.
 */
public final class RerollSeed {

    private RerollSeed() {
    }

    public static long of(String rerollToken, String employeeId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((rerollToken + ":" + employeeId).getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
