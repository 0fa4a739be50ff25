package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.model.DbiHeader;
import com.goerdes.pdbdbi.model.DbiVersion;
import com.goerdes.pdbdbi.msf.InfoStream;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import static com.goerdes.pdbdbi.utils.ByteUtils.isAligned;

/**
 * Reads and validates the fixed header of the DBI stream.
 */
final class DbiHeaderDecoder {

    private DbiHeaderDecoder() {
    }

    /**
     * Reads the header from the start of {@code reader} and checks it against
     * the stream length and the PDB age.
     *
     * @param reader positioned at the start of the DBI stream
     * @param info   source of the PDB-wide age
     * @return the validated header
     * @throws RawError on the first failed check
     */
    static DbiHeader decode(BinaryStreamReader reader, InfoStream info) {
        if (reader.bytesRemaining() < DbiHeader.SIZE) {
            throw RawError.corrupt("DBI Stream does not contain a header.");
        }
        DbiHeader header = read(reader);

        if (header.versionSignature() != -1) {
            throw RawError.corrupt("Invalid DBI version signature.");
        }
        // Version 7 is present in every PDB written in the last decades.
        if (header.versionHeader() < DbiVersion.V70.value()) {
            throw RawError.unsupported("Unsupported DBI version.");
        }
        if (header.age() != info.getAge()) {
            throw RawError.corrupt("DBI Age does not match PDB Age.");
        }
        if (reader.getLength() != DbiHeader.SIZE + header.substreamBytes()) {
            throw RawError.corrupt("DBI Length does not equal sum of substreams.");
        }

        // Only these substreams are guaranteed to be aligned.
        checkAligned(header.modiSubstreamSize(), "MODI");
        checkAligned(header.secContrSubstreamSize(), "section contribution");
        checkAligned(header.sectionMapSize(), "section map");
        checkAligned(header.fileInfoSize(), "file info");
        checkAligned(header.typeServerSize(), "type server");
        return header;
    }

    private static void checkAligned(int size, String substream) {
        if (!isAligned(size, Integer.BYTES)) {
            throw RawError.corrupt("DBI " + substream + " substream not aligned.");
        }
    }

    private static DbiHeader read(BinaryStreamReader reader) {
        return new DbiHeader(
                reader.readInt32(),
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readInt32(),
                reader.readInt32(),
                reader.readInt32(),
                reader.readInt32(),
                reader.readInt32(),
                reader.readUInt32(),
                reader.readInt32(),
                reader.readInt32(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt32()
        );
    }
}
