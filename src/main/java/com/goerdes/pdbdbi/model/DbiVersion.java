package com.goerdes.pdbdbi.model;

import java.util.Arrays;

/**
 * Known values of the DBI header's version field. Versions are dates of the
 * form {@code yyyymmdd}, except for the oldest one.
 */
public enum DbiVersion {
    VC41(930803L),
    V50(19960307L),
    V60(19970606L),
    V70(19990903L),
    V110(20091201L),

    /** A version number that none of the constants above describes. */
    UNKNOWN(-1L);

    private final long value;

    DbiVersion(long value) {
        this.value = value;
    }

    public long value() {
        return value;
    }

    public static DbiVersion fromValue(long value) {
        return Arrays.stream(values())
                .filter(v -> v != UNKNOWN && v.value == value)
                .findFirst()
                .orElse(UNKNOWN);
    }
}
