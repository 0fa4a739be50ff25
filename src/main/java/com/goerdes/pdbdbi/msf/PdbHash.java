package com.goerdes.pdbdbi.msf;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

/**
 * The two string hash functions used by PDB name tables. Both operate on the
 * UTF-8 bytes of the string and return an unsigned 32-bit value.
 */
public final class PdbHash {

    private static final int TO_LOWER_MASK = 0x20202020;

    private static final int V2_SEED = 0xB170A1BF;

    private PdbHash() {
    }

    /**
     * Version 1 hash: xor of the little-endian 32-bit words, then of a trailing
     * 16-bit word and odd byte, finished with a case-folding mask.
     */
    public static long hashStringV1(String str) {
        ByteBuffer buf = ByteBuffer.wrap(str.getBytes(StandardCharsets.UTF_8)).order(LITTLE_ENDIAN);
        int result = 0;
        while (buf.remaining() >= Integer.BYTES) {
            result ^= buf.getInt();
        }
        if (buf.remaining() >= Short.BYTES) {
            result ^= buf.getShort() & 0xFFFF;
        }
        if (buf.hasRemaining()) {
            result ^= buf.get() & 0xFF;
        }
        result |= TO_LOWER_MASK;
        result ^= result >>> 11;
        return Integer.toUnsignedLong(result ^ (result >>> 16));
    }

    /**
     * Version 2 hash: one-at-a-time mixing of the little-endian 32-bit words,
     * then of the trailing bytes, finished with a linear congruential step.
     */
    public static long hashStringV2(String str) {
        ByteBuffer buf = ByteBuffer.wrap(str.getBytes(StandardCharsets.UTF_8)).order(LITTLE_ENDIAN);
        int hash = V2_SEED;
        while (buf.remaining() >= Integer.BYTES) {
            hash = mix(hash, buf.getInt());
        }
        while (buf.hasRemaining()) {
            hash = mix(hash, buf.get() & 0xFF);
        }
        return Integer.toUnsignedLong(hash * 1664525 + 1013904223);
    }

    private static int mix(int hash, int item) {
        hash += item;
        hash += hash << 10;
        return hash ^ (hash >>> 6);
    }
}
