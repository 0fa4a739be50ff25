package com.goerdes.pdbdbi.model;

/**
 * One module record of the module info substream: a 64-byte fixed part
 * followed by the module name and the object file name, each NUL-terminated.
 *
 * @param mod                      currently opened module, unused on disk
 * @param sectionContrib           first section contribution of the module
 * @param flags                    bit 0 written, bit 1 has EC info, bits 8-15 type server index
 * @param moduleStreamIndex        stream holding the module's symbols and line info
 * @param symbolByteSize           bytes of symbol info in that stream
 * @param lineInfoByteSize         bytes of C11 line info in that stream
 * @param c13LineInfoByteSize      bytes of C13 line info in that stream
 * @param numFiles                 number of contributing source files, 16-bit and unreliable
 * @param fileNameOffs             on-disk pointer field, unused
 * @param sourceFileNameIndex      name index of the primary source file
 * @param pdbFilePathNameIndex     name index of the compiler PDB path
 * @param moduleName               module name
 * @param objFileName              object file or library path
 * @param recordLength             encoded length of the record including padding
 */
public record ModInfo(
        long mod,
        SectionContrib sectionContrib,
        int flags,
        int moduleStreamIndex,
        long symbolByteSize,
        long lineInfoByteSize,
        long c13LineInfoByteSize,
        int numFiles,
        long fileNameOffs,
        long sourceFileNameIndex,
        long pdbFilePathNameIndex,
        String moduleName,
        String objFileName,
        int recordLength
) {

    /** Size of the fixed part preceding the two names. */
    public static final int FIXED_SIZE = 64;

    public static final int HAS_EC_FLAG_MASK = 0x2;
    public static final int TYPE_SERVER_INDEX_MASK = 0xFF00;
    public static final int TYPE_SERVER_INDEX_SHIFT = 8;

    public boolean hasECInfo() {
        return (flags & HAS_EC_FLAG_MASK) != 0;
    }

    public int typeServerIndex() {
        return (flags & TYPE_SERVER_INDEX_MASK) >> TYPE_SERVER_INDEX_SHIFT;
    }
}
