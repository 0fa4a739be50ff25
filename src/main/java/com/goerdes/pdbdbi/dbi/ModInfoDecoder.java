package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.model.ModInfo;
import com.goerdes.pdbdbi.model.SectionContrib;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static com.goerdes.pdbdbi.utils.ByteUtils.alignTo;

/**
 * Iterates the variable-length module records of the module info substream.
 * The substream has no record count; records are read until it is exhausted.
 */
final class ModInfoDecoder implements Iterable<ModInfo> {

    private final ByteBuffer substream;

    ModInfoDecoder(ByteBuffer substream) {
        this.substream = substream;
    }

    @Override
    public Iterator<ModInfo> iterator() {
        BinaryStreamReader reader = new BinaryStreamReader(substream);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return reader.bytesRemaining() > 0;
            }

            @Override
            public ModInfo next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return read(reader);
            }
        };
    }

    /**
     * Reads one record and advances past its padding.
     *
     * @throws RawError if the record extends past the end of the substream
     */
    static ModInfo read(BinaryStreamReader reader) {
        int start = reader.getOffset();
        if (reader.bytesRemaining() < ModInfo.FIXED_SIZE) {
            throw RawError.corrupt("Module info record at offset " + start + " is truncated.");
        }
        long mod = reader.readUInt32();
        SectionContrib sc = SectionContribDecoder.readContrib(reader);
        int flags = reader.readUInt16();
        int moduleStream = reader.readUInt16();
        long symBytes = reader.readUInt32();
        long lineBytes = reader.readUInt32();
        long c13Bytes = reader.readUInt32();
        int numFiles = reader.readUInt16();
        reader.skip(2);
        long fileNameOffs = reader.readUInt32();
        long srcFileNameNI = reader.readUInt32();
        long pdbFilePathNI = reader.readUInt32();
        String moduleName = reader.readZeroString();
        String objFileName = reader.readZeroString();

        int length = (int) alignTo(reader.getOffset() - start, Integer.BYTES);
        int padding = start + length - reader.getOffset();
        if (padding > reader.bytesRemaining()) {
            throw RawError.corrupt("Module info record at offset " + start + " is truncated.");
        }
        reader.skip(padding);

        return new ModInfo(mod, sc, flags, moduleStream, symBytes, lineBytes, c13Bytes, numFiles,
                fileNameOffs, srcFileNameNI, pdbFilePathNI, moduleName, objFileName, length);
    }
}
