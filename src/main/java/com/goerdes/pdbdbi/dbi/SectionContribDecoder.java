package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.model.SectionContrib;
import com.goerdes.pdbdbi.model.SectionContrib2;
import com.goerdes.pdbdbi.model.SectionContribVersion;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Decodes the section contribution substream: a version tag followed by a
 * packed array of records in the layout the tag selects.
 */
final class SectionContribDecoder {

    private SectionContribDecoder() {
    }

    static SectionContribs decode(ByteBuffer substream) {
        BinaryStreamReader reader = new BinaryStreamReader(substream);
        int tag = reader.readInt32();
        SectionContribVersion version = SectionContribVersion.fromTag(tag)
                .orElseThrow(() -> RawError.unsupported("Unsupported DBI Section Contribution version"));

        if (reader.bytesRemaining() % version.recordSize() != 0) {
            throw RawError.corrupt("Invalid number of bytes of section contributions");
        }
        long count = reader.bytesRemaining() / version.recordSize();

        return switch (version) {
            case VER60 -> new SectionContribs(version,
                    reader.readArray(count, SectionContrib.SIZE, SectionContribDecoder::readContrib), List.of());
            case V2 -> new SectionContribs(version,
                    List.of(), reader.readArray(count, SectionContrib2.SIZE, SectionContribDecoder::readContrib2));
        };
    }

    static SectionContrib readContrib(BinaryStreamReader reader) {
        int section = reader.readUInt16();
        reader.skip(2);
        int offset = reader.readInt32();
        int size = reader.readInt32();
        long characteristics = reader.readUInt32();
        int imod = reader.readUInt16();
        reader.skip(2);
        long dataCrc = reader.readUInt32();
        long relocCrc = reader.readUInt32();
        return new SectionContrib(section, offset, size, characteristics, imod, dataCrc, relocCrc);
    }

    static SectionContrib2 readContrib2(BinaryStreamReader reader) {
        SectionContrib base = readContrib(reader);
        return new SectionContrib2(base, reader.readUInt32());
    }
}
