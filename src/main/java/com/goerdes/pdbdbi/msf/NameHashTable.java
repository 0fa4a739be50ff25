package com.goerdes.pdbdbi.msf;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Serialized string table with an open-addressing index, as stored in the
 * DBI stream's EC substream and in the PDB's {@code /names} stream.
 * <pre>
 *   u32 Signature (0xEFFEEFFE)
 *   u32 HashVersion (1 or 2)
 *   u32 ByteSize
 *   char Names[ByteSize]          NUL-terminated strings, addressed by offset
 *   u32 HashCount
 *   u32 Ids[HashCount]            name offsets, 0 for an empty slot
 *   u32 NameCount
 * </pre>
 */
public final class NameHashTable {

    public static final long SIGNATURE = 0xEFFEEFFEL;

    private static final NameHashTable EMPTY = new NameHashTable(SIGNATURE, 1, ByteBuffer.allocate(0), new long[0], 0);

    private final long signature;
    private final long hashVersion;
    private final ByteBuffer names;
    private final long[] ids;
    private final long nameCount;

    private NameHashTable(long signature, long hashVersion, ByteBuffer names, long[] ids, long nameCount) {
        this.signature = signature;
        this.hashVersion = hashVersion;
        this.names = names;
        this.ids = ids;
        this.nameCount = nameCount;
    }

    public static NameHashTable empty() {
        return EMPTY;
    }

    /**
     * Decodes a table. An empty range decodes to the empty table.
     *
     * @param bytes the serialized table
     * @return the decoded table
     * @throws RawError if the table is malformed or uses an unknown hash version
     */
    public static NameHashTable load(ByteBuffer bytes) {
        BinaryStreamReader reader = new BinaryStreamReader(bytes);
        if (reader.getLength() == 0) {
            return EMPTY;
        }

        long signature = reader.readUInt32();
        long hashVersion = reader.readUInt32();
        long byteSize = reader.readUInt32();
        if (signature != SIGNATURE) {
            throw RawError.corrupt("Invalid hash table signature");
        }
        if (hashVersion != 1 && hashVersion != 2) {
            throw RawError.unsupported("Unsupported hash version");
        }
        if (byteSize > reader.bytesRemaining()) {
            throw RawError.corrupt("Invalid hash table byte length");
        }
        ByteBuffer names = reader.readSubstream(byteSize);

        long hashCount = reader.readUInt32();
        if (hashCount * Integer.BYTES > reader.bytesRemaining()) {
            throw RawError.corrupt("Could not read bucket array");
        }
        long[] ids = reader.readUInt32Array(hashCount);

        if (reader.bytesRemaining() < Integer.BYTES) {
            throw RawError.corrupt("Missing name count");
        }
        long nameCount = reader.readUInt32();
        return new NameHashTable(signature, hashVersion, names, ids, nameCount);
    }

    public long getSignature() {
        return signature;
    }

    public long getHashVersion() {
        return hashVersion;
    }

    public long getNameCount() {
        return nameCount;
    }

    public long[] getIds() {
        return Arrays.copyOf(ids, ids.length);
    }

    /**
     * Resolves a name offset. Offset 0 is the empty string.
     *
     * @param id the offset of the name in the names buffer
     * @return the name stored at that offset
     * @throws RawError if the offset is outside the buffer or the name is unterminated
     */
    public String getStringForId(long id) {
        if (id == 0) {
            return "";
        }
        BinaryStreamReader reader = new BinaryStreamReader(names);
        reader.setOffset(id);
        return reader.readZeroString();
    }

    /**
     * Looks a name up through the hash index, probing linearly from its home bucket.
     *
     * @param str the name to find
     * @return its offset, or 0 if the table does not contain it
     */
    public long getIdForString(String str) {
        if (ids.length == 0) {
            return 0;
        }
        long hash = hashVersion == 1 ? PdbHash.hashStringV1(str) : PdbHash.hashStringV2(str);
        int start = (int) (hash % ids.length);
        for (int i = 0; i < ids.length; i++) {
            long id = ids[(start + i) % ids.length];
            if (id != 0 && str.equals(getStringForId(id))) {
                return id;
            }
        }
        return 0;
    }
}
