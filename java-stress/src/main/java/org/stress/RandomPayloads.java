package org.stress;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Random key and value generators used to fill workload payloads.
 *
 * <p>All methods take the {@code Random} to draw from, so a seeded generator
 * reproduces the same payloads across runs.
 *
 * @author krishna.sundar
 * @version 1.0
 */
public final class RandomPayloads {
    private static final char[] ALPHANUMERIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final char[] ALPHABETIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();

    private RandomPayloads() {}

    /**
     * Generates a random alphanumeric string.
     *
     * @param len Number of characters
     * @param rnd Source of randomness
     * @return A string of {@code len} characters from {@code [A-Za-z0-9]}
     */
    public static String ranString(int len, Random rnd) {
        return fromCharset(ALPHANUMERIC, len, rnd);
    }

    /**
     * Generates a random string made of ASCII letters only.
     *
     * @param len Number of characters
     * @param rnd Source of randomness
     * @return A string of {@code len} characters from {@code [A-Za-z]}
     */
    public static String randAlphaString(int len, Random rnd) {
        return fromCharset(ALPHABETIC, len, rnd);
    }

    /**
     * Generates an array of random bytes.
     *
     * @param len Number of bytes
     * @param rnd Source of randomness
     * @return A new array of {@code len} random bytes
     */
    public static byte[] ranBytes(int len, Random rnd) {
        requireNonNegative("len", len);
        byte[] bytes = new byte[len];
        rnd.nextBytes(bytes);
        return bytes;
    }

    /**
     * Generates {@code count} byte arrays of {@code size} bytes each.
     *
     * <p>With {@code unique}, every array differs from every other; a collision is
     * redrawn. Without it, a single random key is drawn and repeated {@code count}
     * times (as separate copies).
     *
     * @throws IllegalArgumentException if {@code unique} is requested and fewer than
     *         {@code count} distinct arrays of {@code size} bytes exist
     */
    public static List<byte[]> generateRandomByteVector(int count, int size, Random rnd, boolean unique) {
        requireNonNegative("count", count);
        requireNonNegative("size", size);
        List<byte[]> keys = new ArrayList<>(count);
        if (unique) {
            requireEnoughCombinations(count, 256, size);
            Set<ByteBuffer> seen = new LinkedHashSet<>(Math.max(16, count));
            while (seen.size() < count) {
                seen.add(ByteBuffer.wrap(ranBytes(size, rnd)));
            }
            for (ByteBuffer key : seen) {
                keys.add(key.array());
            }
        } else {
            byte[] key = ranBytes(size, rnd);
            for (int i = 0; i < count; i++) {
                keys.add(Arrays.copyOf(key, key.length));
            }
        }
        return keys;
    }

    /**
     * Generates {@code count} alphanumeric strings of {@code size} characters each.
     *
     * <p>With {@code unique}, no string repeats. Without it, strings are drawn
     * independently and may collide.
     *
     * @throws IllegalArgumentException if {@code unique} is requested and fewer than
     *         {@code count} distinct strings of {@code size} characters exist
     */
    public static List<String> generateRandomStringVector(int count, int size, Random rnd, boolean unique) {
        requireNonNegative("count", count);
        requireNonNegative("size", size);
        if (unique) {
            requireEnoughCombinations(count, ALPHANUMERIC.length, size);
            Set<String> seen = new LinkedHashSet<>(Math.max(16, count));
            while (seen.size() < count) {
                seen.add(ranString(size, rnd));
            }
            return new ArrayList<>(seen);
        }
        List<String> keys = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            keys.add(ranString(size, rnd));
        }
        return keys;
    }

    private static String fromCharset(char[] charset, int len, Random rnd) {
        requireNonNegative("len", len);
        char[] out = new char[len];
        for (int i = 0; i < len; i++) {
            out[i] = charset[rnd.nextInt(charset.length)];
        }
        return new String(out);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }

    private static void requireEnoughCombinations(int count, int symbols, int size) {
        double combinations = Math.pow(symbols, size);
        if (count > combinations) {
            throw new IllegalArgumentException("cannot draw " + count + " unique values of length "
                    + size + " from " + symbols + " symbols");
        }
    }
}
