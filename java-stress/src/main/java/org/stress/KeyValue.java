package org.stress;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * One job payload: a key and the value stored under it.
 *
 * <p>The constructor copies both arrays. The accessors hand out the stored arrays
 * without copying, since they are bound once per operation; callers must treat
 * them as read-only.
 */
public final class KeyValue {
    private final byte[] key;
    private final byte[] value;

    public KeyValue(byte[] key, byte[] value) {
        this.key = Arrays.copyOf(key, key.length);
        this.value = Arrays.copyOf(value, value.length);
    }

    /** @return the key, shared with this payload; do not modify */
    public byte[] key() {
        return key;
    }

    /** @return the value, shared with this payload; do not modify */
    public byte[] value() {
        return value;
    }

    /**
     * Generates {@code count} payloads with pairwise distinct keys and independently drawn values.
     *
     * @param count Number of payloads
     * @param keySize Key length in bytes
     * @param valueSize Value length in bytes
     * @param rnd Source of randomness
     * @return The payloads, in generation order
     */
    public static List<KeyValue> generate(int count, int keySize, int valueSize, Random rnd) {
        List<byte[]> keys = RandomPayloads.generateRandomByteVector(count, keySize, rnd, true);
        List<KeyValue> out = new ArrayList<>(count);
        for (byte[] key : keys) {
            out.add(new KeyValue(key, RandomPayloads.ranBytes(valueSize, rnd)));
        }
        return out;
    }
}
