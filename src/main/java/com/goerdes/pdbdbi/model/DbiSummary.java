package com.goerdes.pdbdbi.model;

import lombok.Builder;

import java.util.List;

/**
 * JSON view of a decoded DBI stream, returned by the REST API.
 */
@Builder
public record DbiSummary(
        String filename,
        String sha256,
        int numStreams,
        String dbiVersion,
        long versionHeader,
        long age,
        int buildMajorVersion,
        int buildMinorVersion,
        int pdbDllVersion,
        String machineType,
        boolean incrementallyLinked,
        boolean stripped,
        boolean hasCTypes,
        int globalSymbolStreamIndex,
        int publicSymbolStreamIndex,
        int symRecordStreamIndex,
        String sectionContribVersion,
        int sectionContribCount,
        int sectionMapEntryCount,
        List<String> sectionHeaders,
        int fpoRecordCount,
        long ecNameCount,
        int sourceFileCount,
        List<ModuleSummary> modules
) {

    /**
     * One module and the source files compiled into it.
     *
     * @param moduleName        the module name
     * @param objFileName       the object file or library path
     * @param moduleStreamIndex stream with the module's symbols
     * @param sourceFiles       the module's source files
     */
    public record ModuleSummary(String moduleName, String objFileName, int moduleStreamIndex, List<String> sourceFiles) {

        public static ModuleSummary of(ModuleInfoEx module) {
            return new ModuleSummary(
                    module.info().moduleName(),
                    module.info().objFileName(),
                    module.info().moduleStreamIndex(),
                    module.sourceFiles()
            );
        }
    }
}
