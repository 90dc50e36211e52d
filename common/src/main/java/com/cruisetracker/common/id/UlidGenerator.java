package com.cruisetracker.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs (Universally Unique Lexicographically Sortable Identifiers).
 * Layout: 48-bit millisecond timestamp followed by 80 random bits, rendered as
 * 26 Crockford Base32 characters (5 bits per character, most significant first).
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int LENGTH = 26;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Instant.now());
    }

    /**
     * Generates a ULID whose time component is {@code timestamp}. Snapshots and captures
     * use their own capture instant so ids sort with the time series.
     */
    public static String generate(Instant timestamp) {
        long millis = timestamp.toEpochMilli();
        byte[] randomness = new byte[10];
        RANDOM.nextBytes(randomness);

        // 128 bits: high = 48-bit time + top 16 random bits, low = remaining 64 random bits
        long high = (millis << 16) | ((randomness[0] & 0xFFL) << 8) | (randomness[1] & 0xFFL);
        long low = 0;
        for (int i = 2; i < 10; i++) {
            low = (low << 8) | (randomness[i] & 0xFFL);
        }
        return encode(high, low);
    }

    private static String encode(long high, long low) {
        char[] chars = new char[LENGTH];
        // 26 chars * 5 bits = 130 bits; the two leading bits are always zero
        for (int i = LENGTH - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (low & 0x1F)];
            low = (low >>> 5) | ((high & 0x1F) << 59);
            high >>>= 5;
        }
        return new String(chars);
    }
}
