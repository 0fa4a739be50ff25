package com.goerdes.pdbdbi.model;

/**
 * The fixed 64-byte header at the start of the DBI stream.
 * <p>
 * Build number and flags are bitfields in the file. They are kept as plain
 * integers here and split with explicit masks, never through a struct layout.
 *
 * @param versionSignature        always -1
 * @param versionHeader           the DBI format version, see {@link DbiVersion}
 * @param age                     must match the age in the Info stream
 * @param globalSymbolStreamIndex stream number of the global symbol hash
 * @param buildNumber             toolchain build, minor in bits 0-7, major in bits 8-14
 * @param publicSymbolStreamIndex stream number of the public symbol hash
 * @param pdbDllVersion           version of the mspdb DLL that wrote the file
 * @param symRecordStreamIndex    stream number of the symbol records
 * @param pdbDllRbld              rebuild number of the mspdb DLL
 * @param modiSubstreamSize       byte size of the module info substream
 * @param secContrSubstreamSize   byte size of the section contribution substream
 * @param sectionMapSize          byte size of the section map substream
 * @param fileInfoSize            byte size of the file info substream
 * @param typeServerSize          byte size of the type server map substream
 * @param mfcTypeServerIndex      index of the MFC type server
 * @param optionalDbgHdrSize      byte size of the debug stream index array
 * @param ecSubstreamSize         byte size of the EC substream
 * @param flags                   incremental (bit 0), stripped (bit 1), has C types (bit 2)
 * @param machineType             raw machine code, see {@link PdbMachine}
 * @param reserved                padding to 64 bytes
 */
public record DbiHeader(
        int versionSignature,
        long versionHeader,
        long age,
        int globalSymbolStreamIndex,
        int buildNumber,
        int publicSymbolStreamIndex,
        int pdbDllVersion,
        int symRecordStreamIndex,
        int pdbDllRbld,
        int modiSubstreamSize,
        int secContrSubstreamSize,
        int sectionMapSize,
        int fileInfoSize,
        int typeServerSize,
        long mfcTypeServerIndex,
        int optionalDbgHdrSize,
        int ecSubstreamSize,
        int flags,
        int machineType,
        long reserved
) {

    public static final int SIZE = 64;

    public static final int FLAG_INCREMENTAL_MASK = 0x0001;
    public static final int FLAG_STRIPPED_MASK = 0x0002;
    public static final int FLAG_HAS_C_TYPES_MASK = 0x0004;

    public static final int BUILD_MINOR_MASK = 0x00FF;
    public static final int BUILD_MINOR_SHIFT = 0;
    public static final int BUILD_MAJOR_MASK = 0x7F00;
    public static final int BUILD_MAJOR_SHIFT = 8;

    public boolean isIncrementallyLinked() {
        return (flags & FLAG_INCREMENTAL_MASK) != 0;
    }

    public boolean isStripped() {
        return (flags & FLAG_STRIPPED_MASK) != 0;
    }

    public boolean hasCTypes() {
        return (flags & FLAG_HAS_C_TYPES_MASK) != 0;
    }

    public int buildMajorVersion() {
        return (buildNumber & BUILD_MAJOR_MASK) >> BUILD_MAJOR_SHIFT;
    }

    public int buildMinorVersion() {
        return (buildNumber & BUILD_MINOR_MASK) >> BUILD_MINOR_SHIFT;
    }

    /**
     * Sum of all seven declared substream sizes. Sizes are signed in the file,
     * so the sum is taken in 64 bits.
     */
    public long substreamBytes() {
        return (long) modiSubstreamSize + secContrSubstreamSize + sectionMapSize + fileInfoSize
                + typeServerSize + optionalDbgHdrSize + ecSubstreamSize;
    }
}
