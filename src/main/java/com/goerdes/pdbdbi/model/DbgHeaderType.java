package com.goerdes.pdbdbi.model;

/**
 * Slots of the optional debug header array at the end of the DBI stream.
 * Each slot holds the number of the stream carrying that kind of data,
 * or {@link #INVALID_STREAM_INDEX} if the PDB has none.
 */
public enum DbgHeaderType {
    FPO,
    EXCEPTION,
    FIXUP,
    OMAP_TO_SRC,
    OMAP_FROM_SRC,
    SECTION_HDR,
    TOKEN_RID_MAP,
    XDATA,
    PDATA,
    NEW_FPO,
    SECTION_HDR_ORIG;

    public static final int INVALID_STREAM_INDEX = 0xFFFF;

    /** Position of this kind in the debug header array. */
    public int slot() {
        return ordinal();
    }
}
