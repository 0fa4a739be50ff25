package com.goerdes.pdbdbi.utils;

import com.goerdes.pdbdbi.exception.FileProcessingException;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

/**
 * Utility methods for the little-endian, 4-byte aligned layouts used by PDB streams.
 */
public final class ByteUtils {

    private ByteUtils() {
    }

    /**
     * Rounds {@code value} up to the next multiple of {@code alignment}.
     *
     * @param value     the value to align
     * @param alignment the alignment, must be a power of two
     * @return the aligned value
     */
    public static long alignTo(long value, int alignment) {
        return (value + alignment - 1) & -((long) alignment);
    }

    public static boolean isAligned(long value, int alignment) {
        return value % alignment == 0;
    }

    /**
     * Wraps the given bytes into a read-only little-endian buffer positioned at zero.
     *
     * @param bytes the backing bytes
     * @return a read-only view over {@code bytes}
     */
    public static ByteBuffer littleEndian(byte[] bytes) {
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer().order(LITTLE_ENDIAN);
    }

    /**
     * Copies the remaining bytes of {@code buf} without moving its position.
     *
     * @param buf the source buffer
     * @return a new array with the remaining content
     */
    public static byte[] toArray(ByteBuffer buf) {
        byte[] out = new byte[buf.remaining()];
        buf.duplicate().get(out);
        return out;
    }

    /**
     * Computes the SHA-256 digest of the given byte array and returns
     * it as a lowercase hexadecimal string.
     *
     * @param data the input bytes to hash
     * @return the hex-encoded SHA-256 hash
     * @throws FileProcessingException if SHA-256 algorithm is unavailable
     */
    public static String computeSha256(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(data);
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new FileProcessingException("SHA-256 algorithm not available", e);
        }
    }

}
