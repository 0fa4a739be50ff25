package com.goerdes.pdbdbi.model;

import java.util.Arrays;

/**
 * Target machine recorded in the DBI header, using the COFF machine codes.
 */
public enum PdbMachine {
    INVALID(0xFFFF),
    UNKNOWN(0x0),
    AM33(0x13),
    AMD64(0x8664),
    ARM(0x1C0),
    ARM_NT(0x1C4),
    EBC(0xEBC),
    X86(0x14C),
    IA64(0x200),
    M32R(0x9041),
    MIPS16(0x266),
    MIPS_FPU(0x366),
    MIPS_FPU16(0x466),
    POWER_PC(0x1F0),
    POWER_PC_FP(0x1F1),
    R4000(0x166),
    SH3(0x1A2),
    SH3_DSP(0x1A3),
    SH4(0x1A6),
    SH5(0x1A8),
    THUMB(0x1C2),
    WCE_MIPS_V2(0x169);

    private final int code;

    PdbMachine(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @param code the raw 16-bit machine code
     * @return the matching machine, or {@link #UNKNOWN} for an unlisted code
     */
    public static PdbMachine fromCode(int code) {
        return Arrays.stream(values())
                .filter(m -> m.code == code)
                .findFirst()
                .orElse(UNKNOWN);
    }
}
