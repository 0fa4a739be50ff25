package com.goerdes.pdbdbi.utils;

import com.goerdes.pdbdbi.exception.RawError;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

/**
 * Sequential little-endian cursor over a byte range. Every read is checked
 * against the bytes remaining in the range; running past the end is reported
 * as a corrupt file.
 */
public class BinaryStreamReader {

    private final ByteBuffer data;

    /**
     * Creates a reader over the remaining bytes of {@code source}. The source
     * buffer's position is not modified.
     *
     * @param source the range to read
     */
    public BinaryStreamReader(ByteBuffer source) {
        this.data = source.slice().order(LITTLE_ENDIAN);
    }

    public int getLength() {
        return data.limit();
    }

    public int getOffset() {
        return data.position();
    }

    /**
     * Moves the cursor to an absolute offset inside the range.
     *
     * @param offset the new position, at most {@link #getLength()}
     */
    public void setOffset(long offset) {
        if (offset < 0 || offset > data.limit()) {
            throw RawError.corrupt("Seek to offset " + offset + " outside a stream of " + data.limit() + " bytes.");
        }
        data.position((int) offset);
    }

    public int bytesRemaining() {
        return data.remaining();
    }

    public int readUInt8() {
        ensureAvailable(Byte.BYTES);
        return data.get() & 0xFF;
    }

    public int readUInt16() {
        ensureAvailable(Short.BYTES);
        return data.getShort() & 0xFFFF;
    }

    public int readInt32() {
        ensureAvailable(Integer.BYTES);
        return data.getInt();
    }

    public long readUInt32() {
        return Integer.toUnsignedLong(readInt32());
    }

    public byte[] readBytes(int length) {
        ensureAvailable(length);
        byte[] out = new byte[length];
        data.get(out);
        return out;
    }

    public void skip(int length) {
        ensureAvailable(length);
        data.position(data.position() + length);
    }

    /**
     * Reads {@code count} unsigned 16-bit values.
     */
    public int[] readUInt16Array(int count) {
        ensureAvailable((long) count * Short.BYTES);
        int[] out = new int[count];
        for (int i = 0; i < count; i++) {
            out[i] = data.getShort() & 0xFFFF;
        }
        return out;
    }

    /**
     * Reads {@code count} unsigned 32-bit values.
     */
    public long[] readUInt32Array(long count) {
        ensureAvailable(count * Integer.BYTES);
        long[] out = new long[(int) count];
        for (int i = 0; i < out.length; i++) {
            out[i] = Integer.toUnsignedLong(data.getInt());
        }
        return out;
    }

    /**
     * Reads a packed array of fixed-size records. The whole array is bounds
     * checked before the first record is decoded.
     *
     * @param count      number of records
     * @param recordSize encoded size of one record in bytes
     * @param decoder    reads exactly {@code recordSize} bytes from the reader it is given
     * @return an unmodifiable list of decoded records
     */
    public <T> List<T> readArray(long count, int recordSize, Function<BinaryStreamReader, T> decoder) {
        ensureAvailable(count * recordSize);
        List<T> out = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            BinaryStreamReader record = new BinaryStreamReader(readSubstream(recordSize));
            out.add(decoder.apply(record));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Slices the next {@code length} bytes off as an independent read-only range.
     */
    public ByteBuffer readSubstream(long length) {
        ensureAvailable(length);
        ByteBuffer slice = data.slice();
        slice.limit((int) length);
        data.position(data.position() + (int) length);
        return slice.asReadOnlyBuffer().order(LITTLE_ENDIAN);
    }

    /**
     * Slices off everything that is left in the range.
     */
    public ByteBuffer readRemaining() {
        return readSubstream(data.remaining());
    }

    /**
     * Reads a NUL-terminated UTF-8 string and consumes its terminator.
     */
    public String readZeroString() {
        int start = data.position();
        int end = StringsUtil.indexOfNul(data, start);
        if (end < 0) {
            throw RawError.corrupt("Unterminated string at offset " + start + ".");
        }
        String value = StringsUtil.decode(data, start, end);
        data.position(end + 1);
        return value;
    }

    private void ensureAvailable(long length) {
        if (length < 0 || length > data.remaining()) {
            throw RawError.corrupt("Stream read of " + length + " bytes at offset " + data.position()
                    + " exceeds the " + data.remaining() + " bytes remaining.");
        }
    }
}
