package com.goerdes.pdbdbi.services;

import com.goerdes.pdbdbi.components.DbiStreamFactory;
import com.goerdes.pdbdbi.dbi.DbiStream;
import com.goerdes.pdbdbi.exception.FileProcessingException;
import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.model.CoffSection;
import com.goerdes.pdbdbi.model.DbiSummary;
import com.goerdes.pdbdbi.model.DbiSummary.ModuleSummary;
import com.goerdes.pdbdbi.msf.InMemoryStreamDirectory;
import com.goerdes.pdbdbi.utils.ByteUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Service that decodes the DBI stream of an uploaded PDB stream bundle and
 * summarizes it.
 * <p>
 * A bundle is a ZIP archive with one entry per PDB stream, named by stream
 * number (see {@link InMemoryStreamDirectory#fromZip}).
 */
@Service
@RequiredArgsConstructor
public class DbiAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(DbiAnalysisService.class);

    private final DbiStreamFactory factory;

    /**
     * Decodes the bundle's DBI stream and returns its summary.
     *
     * @param bundle the uploaded ZIP archive
     * @return header fields, modules with their source files and table sizes
     * @throws FileProcessingException if the bundle cannot be read or the DBI stream is invalid
     */
    public DbiSummary analyze(MultipartFile bundle) {
        requireNonNull(bundle, "Bundle must not be null");
        log.info("Analyzing: {}", bundle.getOriginalFilename());

        byte[] content = readBundle(bundle);
        InMemoryStreamDirectory directory = openDirectory(content);
        DbiStream dbi = load(bundle.getOriginalFilename(), directory);

        return DbiSummary.builder()
                .filename(bundle.getOriginalFilename())
                .sha256(ByteUtils.computeSha256(content))
                .numStreams(directory.getNumStreams())
                .dbiVersion(dbi.getDbiVersion().name())
                .versionHeader(dbi.getHeader().versionHeader())
                .age(dbi.getAge())
                .buildMajorVersion(dbi.getBuildMajorVersion())
                .buildMinorVersion(dbi.getBuildMinorVersion())
                .pdbDllVersion(dbi.getPdbDllVersion())
                .machineType(dbi.getMachineType().name())
                .incrementallyLinked(dbi.isIncrementallyLinked())
                .stripped(dbi.isStripped())
                .hasCTypes(dbi.hasCTypes())
                .globalSymbolStreamIndex(dbi.getGlobalSymbolStreamIndex())
                .publicSymbolStreamIndex(dbi.getPublicSymbolStreamIndex())
                .symRecordStreamIndex(dbi.getSymRecordStreamIndex())
                .sectionContribVersion(dbi.getSectionContribVersion().name())
                .sectionContribCount(dbi.getSectionContribs().size() + dbi.getSectionContribs2().size())
                .sectionMapEntryCount(dbi.getSectionMap().size())
                .sectionHeaders(dbi.getSectionHeaders().stream().map(CoffSection::name).toList())
                .fpoRecordCount(dbi.getFpoRecords().size())
                .ecNameCount(dbi.getECNames().getNameCount())
                .sourceFileCount(dbi.getNumSourceFiles())
                .modules(dbi.modules().stream().map(ModuleSummary::of).toList())
                .build();
    }

    /**
     * Lists the modules of the bundle's DBI stream.
     *
     * @param bundle       the uploaded ZIP archive
     * @param sourceFilter if not null, only modules with a source file containing
     *                     this substring (case-insensitive) are returned
     * @return the matching modules in stream order
     */
    public List<ModuleSummary> modules(MultipartFile bundle, String sourceFilter) {
        String needle = sourceFilter == null ? null : sourceFilter.toLowerCase();
        return analyze(bundle).modules().stream()
                .filter(m -> needle == null || m.sourceFiles().stream()
                        .anyMatch(f -> f.toLowerCase().contains(needle)))
                .toList();
    }

    private DbiStream load(String filename, InMemoryStreamDirectory directory) {
        try {
            return factory.create(directory);
        } catch (RawError e) {
            log.warn("Rejected '{}': {} ({})", filename, e.getMessage(), e.getCode());
            throw e;
        }
    }

    private static byte[] readBundle(MultipartFile bundle) {
        try {
            return bundle.getBytes();
        } catch (IOException e) {
            throw new FileProcessingException("I/O error reading bundle: " + e.getMessage(), e);
        }
    }

    private static InMemoryStreamDirectory openDirectory(byte[] content) {
        try {
            return InMemoryStreamDirectory.fromZip(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new FileProcessingException("Bundle is not a readable ZIP archive: " + e.getMessage(), e);
        }
    }
}
