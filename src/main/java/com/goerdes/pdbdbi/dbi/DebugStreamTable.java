package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.exception.RawErrorCode;
import com.goerdes.pdbdbi.model.CoffSection;
import com.goerdes.pdbdbi.model.DbgHeaderType;
import com.goerdes.pdbdbi.model.FpoData;
import com.goerdes.pdbdbi.msf.StreamDirectory;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;
import com.goerdes.pdbdbi.utils.StringsUtil;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static com.goerdes.pdbdbi.model.DbgHeaderType.INVALID_STREAM_INDEX;

/**
 * The optional debug header array: for each {@link DbgHeaderType}, the number
 * of the stream holding that data. Also loads the streams this reader
 * understands, the section headers and the new-style FPO records.
 */
final class DebugStreamTable {

    private final int[] streams;

    DebugStreamTable(int[] streams) {
        this.streams = streams;
    }

    /**
     * @return the stream number for {@code type}, or {@link DbgHeaderType#INVALID_STREAM_INDEX}
     * if the array has no such slot or the slot is unused
     */
    int getStreamIndex(DbgHeaderType type) {
        return type.slot() < streams.length ? streams[type.slot()] : INVALID_STREAM_INDEX;
    }

    int size() {
        return streams.length;
    }

    int[] toArray() {
        return Arrays.copyOf(streams, streams.length);
    }

    /**
     * Loads the section header stream. The stream is mandatory.
     *
     * @throws RawError {@code NO_STREAM} if the stream is absent or out of range,
     *                  {@code CORRUPT_FILE} if its length is not a whole number of headers
     */
    List<CoffSection> loadSectionHeaders(StreamDirectory pdb) {
        int streamNum = getStreamIndex(DbgHeaderType.SECTION_HDR);
        if (streamNum == INVALID_STREAM_INDEX || streamNum >= pdb.getNumStreams()) {
            throw new RawError(RawErrorCode.NO_STREAM, "Section header stream " + streamNum + " does not exist.");
        }
        return loadRecords(pdb, streamNum, CoffSection.SIZE, DebugStreamTable::readCoffSection,
                "Corrupted section header stream.");
    }

    /**
     * Loads the new-style FPO stream, which is optional.
     * <p>
     * A stream whose length is a multiple of the record size is accepted as
     * is; the format offers nothing to check the record count against.
     *
     * @return the FPO records, empty if the PDB has no FPO stream
     * @throws RawError {@code NO_STREAM} if the stream number is out of range,
     *                  {@code CORRUPT_FILE} if its length is not a whole number of records
     */
    List<FpoData> loadFpoRecords(StreamDirectory pdb) {
        int streamNum = getStreamIndex(DbgHeaderType.NEW_FPO);
        if (streamNum == INVALID_STREAM_INDEX) {
            return List.of();
        }
        if (streamNum >= pdb.getNumStreams()) {
            throw new RawError(RawErrorCode.NO_STREAM, "FPO stream " + streamNum + " does not exist.");
        }
        return loadRecords(pdb, streamNum, FpoData.SIZE, DebugStreamTable::readFpoData,
                "Corrupted New FPO stream.");
    }

    private static <T> List<T> loadRecords(StreamDirectory pdb, int streamNum, int recordSize,
                                           Function<BinaryStreamReader, T> decoder, String corruptMessage) {
        long length = pdb.getStreamLength(streamNum);
        if (length % recordSize != 0) {
            throw RawError.corrupt(corruptMessage);
        }
        BinaryStreamReader reader = new BinaryStreamReader(pdb.getStreamBytes(streamNum));
        return reader.readArray(length / recordSize, recordSize, decoder);
    }

    private static CoffSection readCoffSection(BinaryStreamReader reader) {
        return new CoffSection(
                StringsUtil.fixedWidthName(reader.readBytes(CoffSection.NAME_SIZE)),
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt32()
        );
    }

    private static FpoData readFpoData(BinaryStreamReader reader) {
        return new FpoData(
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt32(),
                reader.readUInt16(),
                reader.readUInt16()
        );
    }
}
