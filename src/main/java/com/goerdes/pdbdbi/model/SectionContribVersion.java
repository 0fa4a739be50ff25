package com.goerdes.pdbdbi.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Version tag at the start of the section contribution substream. The tag
 * selects the record layout of every contribution that follows.
 */
public enum SectionContribVersion {
    VER60(0xEFFE0000 + 19970605, SectionContrib.SIZE),
    V2(0xEFFE0000 + 20140516, SectionContrib2.SIZE);

    private final int tag;
    private final int recordSize;

    SectionContribVersion(int tag, int recordSize) {
        this.tag = tag;
        this.recordSize = recordSize;
    }

    public int tag() {
        return tag;
    }

    public int recordSize() {
        return recordSize;
    }

    public static Optional<SectionContribVersion> fromTag(int tag) {
        return Arrays.stream(values()).filter(v -> v.tag == tag).findFirst();
    }
}
