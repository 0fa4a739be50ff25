package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.model.SecMapEntry;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Decodes the section map substream: {@code SecCount}, {@code SecCountLog},
 * then {@code SecCount} fixed-size entries.
 */
final class SectionMapDecoder {

    private SectionMapDecoder() {
    }

    static List<SecMapEntry> decode(ByteBuffer substream) {
        BinaryStreamReader reader = new BinaryStreamReader(substream);
        int secCount = reader.readUInt16();
        reader.readUInt16(); // SecCountLog
        return reader.readArray(secCount, SecMapEntry.SIZE, SectionMapDecoder::readEntry);
    }

    private static SecMapEntry readEntry(BinaryStreamReader reader) {
        return new SecMapEntry(
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt16(),
                reader.readUInt32(),
                reader.readUInt32()
        );
    }
}
