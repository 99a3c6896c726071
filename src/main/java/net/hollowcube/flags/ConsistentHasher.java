package net.hollowcube.flags;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic bucketing of identities into {@code [0, 1)}.
 *
 * <p>Must stay bit-for-bit compatible with the other PostHog SDKs, otherwise the same user would land in
 * different rollout buckets depending on which client evaluated the flag.</p>
 */
final class ConsistentHasher {
    static final String VARIANT_SALT = "variant";

    private static final long LONG_SCALE = 0xfffffffffffffffL;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    static double hash(@NotNull String flagKey, @NotNull String distinctId) {
        return hash(flagKey, distinctId, "");
    }

    static double hash(@NotNull String flagKey, @NotNull String distinctId, @NotNull String salt) {
        final byte[] digest = sha1().digest((flagKey + "." + distinctId + salt).getBytes(StandardCharsets.UTF_8));

        // First 15 hex digits == first 60 bits
        final StringBuilder sb = new StringBuilder(15);
        for (int i = 0; sb.length() < 15; i++) {
            sb.append(HEX[(digest[i] >> 4) & 0xf]);
            if (sb.length() < 15) sb.append(HEX[digest[i] & 0xf]);
        }
        return ((double) Long.parseLong(sb.toString(), 16)) / LONG_SCALE;
    }

    private static @NotNull MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is required to be supported by every JVM", e);
        }
    }

    private ConsistentHasher() {
    }
}
