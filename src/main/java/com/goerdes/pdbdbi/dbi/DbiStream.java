package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.model.CoffSection;
import com.goerdes.pdbdbi.model.DbgHeaderType;
import com.goerdes.pdbdbi.model.DbiHeader;
import com.goerdes.pdbdbi.model.DbiVersion;
import com.goerdes.pdbdbi.model.FpoData;
import com.goerdes.pdbdbi.model.ModInfo;
import com.goerdes.pdbdbi.model.ModuleInfoEx;
import com.goerdes.pdbdbi.model.PdbMachine;
import com.goerdes.pdbdbi.model.SecMapEntry;
import com.goerdes.pdbdbi.model.SectionContrib;
import com.goerdes.pdbdbi.model.SectionContrib2;
import com.goerdes.pdbdbi.model.SectionContribVersion;
import com.goerdes.pdbdbi.model.SectionContribVisitor;
import com.goerdes.pdbdbi.msf.InfoStream;
import com.goerdes.pdbdbi.msf.NameHashTable;
import com.goerdes.pdbdbi.msf.NameTableLoader;
import com.goerdes.pdbdbi.msf.StreamDirectory;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The DBI stream (stream 3) of a PDB: modules, section contributions, the
 * section map, per-module source files and the indexed debug streams.
 * <p>
 * An instance starts {@link State#UNLOADED}. {@link #reload()} decodes the
 * whole stream in one pass and ends in {@link State#READY}, or in
 * {@link State#FAILED} with the first error rethrown and nothing populated.
 * Once ready, an instance is read-only and may be shared between threads.
 * The decoded tables are assigned before the volatile {@code state} is set to
 * {@code READY}, and every accessor reads {@code state} first.
 */
public class DbiStream {

    private static final Logger log = LoggerFactory.getLogger(DbiStream.class);

    public enum State {
        UNLOADED,
        LOADING,
        READY,
        FAILED
    }

    private final StreamDirectory pdb;
    private final ByteBuffer stream;
    private final InfoStream infoStream;
    private final NameTableLoader ecLoader;

    private volatile State state = State.UNLOADED;

    private DbiHeader header;
    private List<ModuleInfoEx> modules;
    private SectionContribs sectionContribs;
    private List<SecMapEntry> sectionMap;
    private FileInfoSubstream fileInfo;
    private DebugStreamTable debugStreams;
    private List<CoffSection> sectionHeaders;
    private List<FpoData> fpoRecords;
    private ByteBuffer typeServerMap;
    private ByteBuffer ecSubstream;
    private NameHashTable ecNames;

    /**
     * @param pdb        directory used to open the indexed debug streams
     * @param stream     the bytes of the DBI stream
     * @param infoStream supplies the PDB age the header must match
     * @param ecLoader   decodes the EC substream
     */
    public DbiStream(StreamDirectory pdb, ByteBuffer stream, InfoStream infoStream, NameTableLoader ecLoader) {
        this.pdb = requireNonNull(pdb, "Stream directory must not be null");
        this.stream = requireNonNull(stream, "DBI stream must not be null");
        this.infoStream = requireNonNull(infoStream, "Info stream must not be null");
        this.ecLoader = requireNonNull(ecLoader, "EC name table loader must not be null");
    }

    public DbiStream(StreamDirectory pdb, ByteBuffer stream, InfoStream infoStream) {
        this(pdb, stream, infoStream, NameHashTable::load);
    }

    /**
     * Decodes the stream. May be called once per instance.
     *
     * @throws RawError              if the stream is malformed or uses an unsupported format
     * @throws IllegalStateException if the stream was already loaded or failed
     */
    public void reload() {
        if (state != State.UNLOADED) {
            throw new IllegalStateException("DBI stream already " + state);
        }
        state = State.LOADING;
        try {
            load();
            state = State.READY;
        } catch (RuntimeException e) {
            state = State.FAILED;
            throw e;
        }
    }

    private void load() {
        BinaryStreamReader reader = new BinaryStreamReader(stream);

        DbiHeader hdr = DbiHeaderDecoder.decode(reader, infoStream);
        log.debug("DBI header accepted: version {}, age {}", hdr.versionHeader(), hdr.age());

        DbiSubstreams substreams = DbiSubstreams.segment(reader, hdr);

        // Module records vary in length, so iterating them is the only way to count them.
        List<ModuleInfoEx.ModuleInfoExBuilder> builders = new ArrayList<>();
        for (ModInfo info : new ModInfoDecoder(substreams.modInfo())) {
            builders.add(ModuleInfoEx.builder().info(info));
        }
        log.debug("Found {} modules", builders.size());

        SectionContribs contribs = SectionContribDecoder.decode(substreams.secContr());
        log.debug("Section contributions: {} x {}", contribs.active().size(), contribs.version());

        DebugStreamTable dbgStreams = substreams.debugStreams();
        List<CoffSection> sections = dbgStreams.loadSectionHeaders(pdb);
        log.debug("Loaded {} section headers", sections.size());

        List<SecMapEntry> secMap = SectionMapDecoder.decode(substreams.secMap());

        FileInfoSubstream files = FileInfoSubstream.decode(substreams.fileInfo(), builders.size());
        files.associate(builders);
        if (files.getDeclaredNumSourceFiles() != (files.getRealNumSourceFiles() & 0xFFFF)) {
            log.debug("File info declares {} source files, found {}",
                    files.getDeclaredNumSourceFiles(), files.getRealNumSourceFiles());
        }

        List<FpoData> fpo = dbgStreams.loadFpoRecords(pdb);
        log.debug("Loaded {} FPO records", fpo.size());

        if (reader.bytesRemaining() > 0) {
            throw RawError.corrupt("Found unexpected bytes in DBI Stream.");
        }

        NameHashTable names = ecLoader.load(substreams.ec());

        header = hdr;
        modules = builders.stream().map(ModuleInfoEx.ModuleInfoExBuilder::build).toList();
        sectionContribs = contribs;
        sectionHeaders = sections;
        sectionMap = secMap;
        fileInfo = files;
        debugStreams = dbgStreams;
        fpoRecords = fpo;
        typeServerMap = substreams.typeServerMap();
        ecSubstream = substreams.ec();
        ecNames = names;

        log.info("Loaded DBI stream: {} modules, {} source files, {} sections, {} FPO records",
                modules.size(), files.getRealNumSourceFiles(), sections.size(), fpo.size());
    }

    /**
     * Persisting changes back into a PDB is not supported; this does nothing.
     */
    public void commit() {
    }

    public State getState() {
        return state;
    }

    public DbiHeader getHeader() {
        requireReady();
        return header;
    }

    public DbiVersion getDbiVersion() {
        return DbiVersion.fromValue(getHeader().versionHeader());
    }

    public long getAge() {
        return getHeader().age();
    }

    public int getGlobalSymbolStreamIndex() {
        return getHeader().globalSymbolStreamIndex();
    }

    public int getPublicSymbolStreamIndex() {
        return getHeader().publicSymbolStreamIndex();
    }

    public int getSymRecordStreamIndex() {
        return getHeader().symRecordStreamIndex();
    }

    public int getPdbDllVersion() {
        return getHeader().pdbDllVersion();
    }

    public int getBuildMajorVersion() {
        return getHeader().buildMajorVersion();
    }

    public int getBuildMinorVersion() {
        return getHeader().buildMinorVersion();
    }

    public boolean isIncrementallyLinked() {
        return getHeader().isIncrementallyLinked();
    }

    public boolean isStripped() {
        return getHeader().isStripped();
    }

    public boolean hasCTypes() {
        return getHeader().hasCTypes();
    }

    public PdbMachine getMachineType() {
        return PdbMachine.fromCode(getHeader().machineType());
    }

    /**
     * @return the modules in stream order, each with its source files
     */
    public List<ModuleInfoEx> modules() {
        requireReady();
        return modules;
    }

    public SectionContribVersion getSectionContribVersion() {
        requireReady();
        return sectionContribs.version();
    }

    /**
     * @return the V60 contributions, empty if the stream uses the V2 layout
     */
    public List<SectionContrib> getSectionContribs() {
        requireReady();
        return sectionContribs.v60();
    }

    /**
     * @return the V2 contributions, empty if the stream uses the V60 layout
     */
    public List<SectionContrib2> getSectionContribs2() {
        requireReady();
        return sectionContribs.v2();
    }

    /**
     * Passes every section contribution, in stream order, to {@code visitor}.
     */
    public void visitSectionContributions(SectionContribVisitor visitor) {
        requireReady();
        sectionContribs.visit(visitor);
    }

    public List<SecMapEntry> getSectionMap() {
        requireReady();
        return sectionMap;
    }

    public List<CoffSection> getSectionHeaders() {
        requireReady();
        return sectionHeaders;
    }

    /**
     * @return the new-style FPO records, empty if the PDB has none
     */
    public List<FpoData> getFpoRecords() {
        requireReady();
        return fpoRecords;
    }

    /**
     * @return the stream number for {@code type}, or {@link DbgHeaderType#INVALID_STREAM_INDEX}
     */
    public int getDebugStreamIndex(DbgHeaderType type) {
        requireReady();
        return debugStreams.getStreamIndex(type);
    }

    public int[] getDebugStreamIndices() {
        requireReady();
        return debugStreams.toArray();
    }

    /**
     * Resolves an entry of the file info substream's file name table.
     *
     * @param index position in the table, counted across all modules
     * @return the file name
     * @throws RawError {@code INDEX_OUT_OF_BOUNDS} if there is no such entry
     */
    public String getFileNameForIndex(long index) {
        requireReady();
        return fileInfo.getFileNameForIndex(index);
    }

    public int getNumSourceFiles() {
        requireReady();
        return fileInfo.getRealNumSourceFiles();
    }

    public ByteBuffer getTypeServerMapSubstream() {
        requireReady();
        return typeServerMap.duplicate().order(typeServerMap.order());
    }

    public ByteBuffer getECSubstream() {
        requireReady();
        return ecSubstream.duplicate().order(ecSubstream.order());
    }

    public NameHashTable getECNames() {
        requireReady();
        return ecNames;
    }

    private void requireReady() {
        if (state != State.READY) {
            throw new IllegalStateException("DBI stream is " + state + ", not READY");
        }
    }
}
