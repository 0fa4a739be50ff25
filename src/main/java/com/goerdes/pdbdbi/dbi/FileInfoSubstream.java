package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.exception.RawErrorCode;
import com.goerdes.pdbdbi.model.ModuleInfoEx;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * The file info substream, which lists the source files of every module.
 * <pre>
 *   u16 NumModules
 *   u16 NumSourceFiles                   not trusted, see below
 *   u16 ModIndices[NumModules]           not used
 *   u16 ModFileCounts[NumModules]
 *   u32 FileNameOffsets[sum(ModFileCounts)]
 *   char Names[]                         NUL-terminated, addressed by offset
 * </pre>
 * A PDB may hold more than 64k source files, so the 16-bit
 * {@code NumSourceFiles} overflows; the real count is the sum of the
 * per-module counts.
 */
final class FileInfoSubstream {

    private final int declaredNumSourceFiles;
    private final int[] modFileCounts;
    private final long[] fileNameOffsets;
    private final ByteBuffer namesBuffer;

    private FileInfoSubstream(int declaredNumSourceFiles, int[] modFileCounts, long[] fileNameOffsets,
                              ByteBuffer namesBuffer) {
        this.declaredNumSourceFiles = declaredNumSourceFiles;
        this.modFileCounts = modFileCounts;
        this.fileNameOffsets = fileNameOffsets;
        this.namesBuffer = namesBuffer;
    }

    /**
     * Reads the substream's tables. Names are resolved later by offset.
     *
     * @param substream   the file info substream
     * @param moduleCount number of records found in the module info substream
     * @throws RawError if the module counts disagree or a table is truncated
     */
    static FileInfoSubstream decode(ByteBuffer substream, int moduleCount) {
        BinaryStreamReader reader = new BinaryStreamReader(substream);
        int numModules = reader.readUInt16();
        int numSourceFiles = reader.readUInt16();

        if (numModules != moduleCount) {
            throw RawError.corrupt("FileInfo substream count doesn't match DBI.");
        }

        reader.readUInt16Array(moduleCount); // ModIndices
        int[] modFileCounts = reader.readUInt16Array(moduleCount);

        long realNumSourceFiles = 0;
        for (int count : modFileCounts) {
            realNumSourceFiles += count;
        }

        long[] fileNameOffsets = reader.readUInt32Array(realNumSourceFiles);
        ByteBuffer namesBuffer = reader.readRemaining();
        return new FileInfoSubstream(numSourceFiles, modFileCounts, fileNameOffsets, namesBuffer);
    }

    int getDeclaredNumSourceFiles() {
        return declaredNumSourceFiles;
    }

    int getRealNumSourceFiles() {
        return fileNameOffsets.length;
    }

    /**
     * Hands each module its source files. One cursor runs over the offsets
     * table for all modules; module {@code i} takes the next
     * {@code ModFileCounts[i]} entries.
     *
     * @param modules one builder per module, in module order
     */
    void associate(List<ModuleInfoEx.ModuleInfoExBuilder> modules) {
        int nextFileIndex = 0;
        for (int i = 0; i < modules.size(); i++) {
            ModuleInfoEx.ModuleInfoExBuilder module = modules.get(i);
            for (int j = 0; j < modFileCounts[i]; j++, nextFileIndex++) {
                module.sourceFile(getFileNameForIndex(nextFileIndex));
            }
        }
    }

    /**
     * Resolves the {@code index}-th entry of the file name offsets table.
     *
     * @param index position in the offsets table
     * @return the file name
     * @throws RawError {@code INDEX_OUT_OF_BOUNDS} past the end of the table,
     *                  {@code CORRUPT_FILE} if the offset leaves the names buffer
     */
    String getFileNameForIndex(long index) {
        if (index < 0 || index >= fileNameOffsets.length) {
            throw new RawError(RawErrorCode.INDEX_OUT_OF_BOUNDS,
                    "File name index " + index + " is outside the " + fileNameOffsets.length + " known files.");
        }
        BinaryStreamReader names = new BinaryStreamReader(namesBuffer);
        names.setOffset(fileNameOffsets[(int) index]);
        return names.readZeroString();
    }
}
