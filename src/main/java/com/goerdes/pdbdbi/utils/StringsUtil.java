package com.goerdes.pdbdbi.utils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for the NUL-terminated and fixed-width strings found in PDB records.
 */
public final class StringsUtil {

    private StringsUtil() {
    }

    /**
     * Finds the first NUL byte at or after {@code from}.
     *
     * @param buf  the buffer to scan, addressed absolutely
     * @param from the first index to inspect
     * @return the index of the NUL byte, or -1 if the buffer ends first
     */
    public static int indexOfNul(ByteBuffer buf, int from) {
        for (int i = from, n = buf.limit(); i < n; i++) {
            if (buf.get(i) == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Decodes {@code buf[from, to)} as UTF-8 without touching the buffer position.
     */
    public static String decode(ByteBuffer buf, int from, int to) {
        byte[] bytes = new byte[to - from];
        for (int i = from; i < to; i++) {
            bytes[i - from] = buf.get(i);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Interprets a fixed-width, NUL-padded name field such as a COFF section name.
     * A name filling the whole field has no terminator.
     *
     * @param raw the raw field bytes
     * @return the name up to the first NUL byte
     */
    public static String fixedWidthName(byte[] raw) {
        int len = 0;
        while (len < raw.length && raw[len] != 0) {
            len++;
        }
        return new String(raw, 0, len, StandardCharsets.UTF_8);
    }
}
