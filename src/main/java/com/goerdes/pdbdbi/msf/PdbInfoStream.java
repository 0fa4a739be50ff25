package com.goerdes.pdbdbi.msf;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Fixed header of the PDB Info stream (stream 1): implementation version,
 * timestamp signature, age and the GUID shared with the matching binary.
 * The named-stream map that follows the header is not decoded.
 *
 * @param version   the PDB implementation version, e.g. {@link #PDB_IMPL_VC70}
 * @param signature seconds since the epoch when the PDB was written
 * @param age       incremented every time the PDB is rewritten
 * @param guid      the GUID matching the binary's debug directory
 */
public record PdbInfoStream(long version, long signature, long age, UUID guid) implements InfoStream {

    public static final int HEADER_SIZE = 28;

    public static final long PDB_IMPL_VC70 = 20000404L;

    /**
     * Decodes the Info stream header.
     *
     * @param stream the Info stream
     * @return the decoded header
     * @throws RawError if the header is missing or the version predates VC70
     */
    public static PdbInfoStream read(ByteBuffer stream) {
        BinaryStreamReader reader = new BinaryStreamReader(stream);
        if (reader.getLength() < HEADER_SIZE) {
            throw RawError.corrupt("PDB Stream does not contain a header.");
        }
        long version = reader.readUInt32();
        long signature = reader.readUInt32();
        long age = reader.readUInt32();
        if (version < PDB_IMPL_VC70) {
            throw RawError.unsupported("Unsupported PDB stream version.");
        }
        return new PdbInfoStream(version, signature, age, readGuid(reader));
    }

    /** Reads a Windows GUID: Data1 u32, Data2 u16, Data3 u16 little-endian, Data4 as raw bytes. */
    private static UUID readGuid(BinaryStreamReader reader) {
        long data1 = reader.readUInt32();
        long data2 = reader.readUInt16();
        long data3 = reader.readUInt16();
        byte[] data4 = reader.readBytes(8);
        long low = 0;
        for (byte b : data4) {
            low = (low << 8) | (b & 0xFF);
        }
        return new UUID((data1 << 32) | (data2 << 16) | data3, low);
    }

    @Override
    public long getAge() {
        return age;
    }
}
