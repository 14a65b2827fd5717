package com.wordlegame.engine;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Maps a calendar date to an index into the answer list, so every player gets the same
 * daily word without a stored schedule. Rotating the salt reshuffles the mapping.
 */
public final class DailySeed {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private DailySeed() {
    }

    /**
     * UTC calendar day of {@code instant} as {@code YYYY-MM-DD}.
     */
    public static String dateKey(Instant instant) {
        return dateKey(LocalDate.ofInstant(instant, ZoneOffset.UTC));
    }

    public static String dateKey(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    public static int wordIndex(Instant instant, String salt, int poolSize) {
        return wordIndex(LocalDate.ofInstant(instant, ZoneOffset.UTC), salt, poolSize);
    }

    /**
     * HMAC-SHA256 of the date key under {@code salt}; the first eight digest bytes, read as an
     * unsigned big-endian integer, are reduced modulo {@code poolSize}.
     *
     * @return an index in {@code [0, poolSize)}, or 0 when {@code poolSize <= 0}
     */
    public static int wordIndex(LocalDate date, String salt, int poolSize) {
        if (poolSize <= 0) {
            return 0;
        }
        byte[] digest = hmac(salt, dateKey(date));
        long value = ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        return (int) Long.remainderUnsigned(value, poolSize);
    }

    private static byte[] hmac(String salt, String message) {
        byte[] key = salt == null ? new byte[0] : salt.getBytes(StandardCharsets.UTF_8);
        if (key.length == 0) {
            // HMAC zero-pads keys, so a single zero byte is the same key as an empty one
            key = new byte[1];
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
