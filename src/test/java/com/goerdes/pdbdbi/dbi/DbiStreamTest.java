package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.exception.RawErrorCode;
import com.goerdes.pdbdbi.model.DbgHeaderType;
import com.goerdes.pdbdbi.model.DbiVersion;
import com.goerdes.pdbdbi.model.FpoData;
import com.goerdes.pdbdbi.model.ModuleInfoEx;
import com.goerdes.pdbdbi.model.PdbMachine;
import com.goerdes.pdbdbi.model.SectionContrib;
import com.goerdes.pdbdbi.model.SectionContrib2;
import com.goerdes.pdbdbi.model.SectionContribVersion;
import com.goerdes.pdbdbi.model.SectionContribVisitor;
import com.goerdes.pdbdbi.msf.InMemoryStreamDirectory;
import com.goerdes.pdbdbi.msf.NameHashTable;
import com.goerdes.pdbdbi.msf.PdbInfoStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.goerdes.pdbdbi.dbi.DbiStreamWriter.DBI_STREAM;
import static com.goerdes.pdbdbi.dbi.DbiStreamWriter.FPO_STREAM;
import static com.goerdes.pdbdbi.dbi.DbiStreamWriter.INFO_STREAM;
import static com.goerdes.pdbdbi.dbi.DbiStreamWriter.SECTION_HEADER_STREAM;
import static org.junit.jupiter.api.Assertions.*;

class DbiStreamTest {

    private static DbiStream load(DbiStreamWriter writer) {
        DbiStream dbi = open(writer);
        dbi.reload();
        return dbi;
    }

    private static DbiStream open(DbiStreamWriter writer) {
        InMemoryStreamDirectory directory = writer.directory();
        PdbInfoStream info = PdbInfoStream.read(directory.getStreamBytes(INFO_STREAM));
        return new DbiStream(directory, directory.getStreamBytes(DBI_STREAM), info);
    }

    private static RawError loadFailure(DbiStreamWriter writer) {
        return assertThrows(RawError.class, () -> load(writer));
    }

    private static DbiStreamWriter twoModules() {
        return new DbiStreamWriter()
                .module("obj\\a.obj", "C:\\build\\obj\\a.obj")
                .module("* Linker *", "");
    }

    @Test
    void loadsStreamWithTwoModules() {
        DbiStream dbi = load(twoModules());

        assertEquals(DbiStream.State.READY, dbi.getState());
        assertEquals(2, dbi.modules().size());
        assertTrue(dbi.getFpoRecords().isEmpty());
        assertTrue(dbi.getSectionMap().isEmpty());
        assertEquals(SectionContribVersion.VER60, dbi.getSectionContribVersion());
        assertEquals(0, dbi.getNumSourceFiles());

        ModuleInfoEx first = dbi.modules().get(0);
        assertEquals("obj\\a.obj", first.info().moduleName());
        assertEquals("C:\\build\\obj\\a.obj", first.info().objFileName());
        assertEquals(12, first.info().moduleStreamIndex());
        assertTrue(first.info().hasECInfo());
        assertTrue(first.sourceFiles().isEmpty());
        assertEquals("* Linker *", dbi.modules().get(1).info().moduleName());
        assertEquals("", dbi.modules().get(1).info().objFileName());
    }

    @Test
    void exposesHeaderFields() {
        DbiStream dbi = load(twoModules().buildNumber(0x8E1C).flags(0x0005).machineType(0x14C));

        assertEquals(DbiVersion.V70, dbi.getDbiVersion());
        assertEquals(DbiStreamWriter.AGE, dbi.getAge());
        assertEquals(14, dbi.getBuildMajorVersion());
        assertEquals(28, dbi.getBuildMinorVersion());
        assertTrue(dbi.isIncrementallyLinked());
        assertFalse(dbi.isStripped());
        assertTrue(dbi.hasCTypes());
        assertEquals(PdbMachine.X86, dbi.getMachineType());
        assertEquals(10, dbi.getGlobalSymbolStreamIndex());
        assertEquals(9, dbi.getPublicSymbolStreamIndex());
        assertEquals(11, dbi.getSymRecordStreamIndex());
        assertEquals(0x7821, dbi.getPdbDllVersion());
    }

    @Test
    void keepsUnknownNewerVersion() {
        DbiStream dbi = load(twoModules().versionHeader(20240101L).machineType(0x1234));

        assertEquals(DbiVersion.UNKNOWN, dbi.getDbiVersion());
        assertEquals(20240101L, dbi.getHeader().versionHeader());
        assertEquals(PdbMachine.UNKNOWN, dbi.getMachineType());
    }

    @Test
    void rejectsStreamShorterThanHeader() {
        InMemoryStreamDirectory directory = twoModules().directory();
        DbiStream dbi = new DbiStream(directory, ByteBuffer.wrap(new byte[63]),
                PdbInfoStream.read(directory.getStreamBytes(INFO_STREAM)));

        RawError error = assertThrows(RawError.class, dbi::reload);
        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("DBI Stream does not contain a header.", error.getMessage());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, -2, Integer.MAX_VALUE, Integer.MIN_VALUE})
    void rejectsSignatureOtherThanAllOnes(int signature) {
        RawError error = loadFailure(twoModules().versionSignature(signature));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("Invalid DBI version signature.", error.getMessage());
    }

    @ParameterizedTest
    @ValueSource(longs = {930803L, 19960307L, 19970606L, 19990902L})
    void rejectsVersionsBeforeV70AsUnsupported(long version) {
        RawError error = loadFailure(twoModules().versionHeader(version));

        assertEquals(RawErrorCode.FEATURE_UNSUPPORTED, error.getCode());
    }

    @Test
    void acceptsV110() {
        assertEquals(DbiVersion.V110, load(twoModules().versionHeader(20091201L)).getDbiVersion());
    }

    @Test
    void rejectsAgeMismatch() {
        RawError error = loadFailure(twoModules().age(DbiStreamWriter.AGE + 1));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("DBI Age does not match PDB Age.", error.getMessage());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 64})
    void rejectsLengthThatDoesNotMatchSubstreams(int trailing) {
        RawError error = loadFailure(twoModules().trailingBytes(trailing));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("DBI Length does not equal sum of substreams.", error.getMessage());
    }

    @Test
    void rejectsMisalignedModuleInfo() {
        byte[] modi = twoModules().modInfoBytes();
        RawError error = loadFailure(twoModules().modInfo(Arrays.copyOf(modi, modi.length + 2)));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("DBI MODI substream not aligned.", error.getMessage());
    }

    @Test
    void rejectsMisalignedSectionContributions() {
        RawError error = loadFailure(twoModules().contributionExtraBytes(2));

        assertEquals("DBI section contribution substream not aligned.", error.getMessage());
    }

    @Test
    void rejectsMisalignedSectionMap() {
        RawError error = loadFailure(twoModules().sectionMap(new byte[]{0, 0, 0, 0, 0, 0}));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("DBI section map substream not aligned.", error.getMessage());
    }

    @Test
    void rejectsMisalignedFileInfo() {
        byte[] fileInfo = DbiStreamWriter.fileInfo(2, 0, new int[]{0, 0}, new long[0], new byte[]{0, 0});

        RawError error = loadFailure(twoModules().fileInfo(Arrays.copyOf(fileInfo, 14)));

        assertEquals("DBI file info substream not aligned.", error.getMessage());
    }

    @Test
    void rejectsMisalignedTypeServerMap() {
        RawError error = loadFailure(twoModules().typeServerMap(new byte[6]));

        assertEquals("DBI type server substream not aligned.", error.getMessage());
    }

    @Test
    void doesNotRequireAlignedEcOrDebugHeader() {
        RawError error = loadFailure(twoModules().ecSubstream(new byte[3]));

        // The EC bytes reach the name table loader, which needs a full header.
        assertNotEquals("DBI Length does not equal sum of substreams.", error.getMessage());
        assertFalse(error.getMessage().contains("not aligned"));
    }

    @Test
    void rejectsTruncatedModuleRecord() {
        byte[] modi = twoModules().modInfoBytes();

        RawError error = loadFailure(twoModules().modInfo(Arrays.copyOf(modi, modi.length - 8)));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
    }

    @Test
    void rejectsFileInfoModuleCountMismatch() {
        RawError error = loadFailure(twoModules().declaredNumModules(3));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("FileInfo substream count doesn't match DBI.", error.getMessage());
    }

    @Test
    void assignsSourceFilesToModulesInOrder() {
        byte[] names = "a.c\0b.c\0".getBytes(StandardCharsets.UTF_8);
        byte[] fileInfo = DbiStreamWriter.fileInfo(2, 2, new int[]{1, 1}, new long[]{0, 4}, names);

        DbiStream dbi = load(twoModules().fileInfo(fileInfo));

        assertEquals(List.of("a.c"), dbi.modules().get(0).sourceFiles());
        assertEquals(List.of("b.c"), dbi.modules().get(1).sourceFiles());
    }

    @Test
    void keepsOneCursorAcrossModules() {
        DbiStream dbi = load(new DbiStreamWriter()
                .module("m0", "m0.obj", "x.h", "m0.cpp", "y.h")
                .module("m1", "m1.obj")
                .module("m2", "m2.obj", "m2.cpp", "x.h"));

        assertEquals(List.of("x.h", "m0.cpp", "y.h"), dbi.modules().get(0).sourceFiles());
        assertEquals(List.of(), dbi.modules().get(1).sourceFiles());
        assertEquals(List.of("m2.cpp", "x.h"), dbi.modules().get(2).sourceFiles());
        assertEquals(5, dbi.getNumSourceFiles());
        assertEquals("m2.cpp", dbi.getFileNameForIndex(3));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 3, 0xFFFF})
    void ignoresDeclaredSourceFileCount(int declared) {
        DbiStream dbi = load(new DbiStreamWriter()
                .module("m0", "m0.obj", "a.c", "b.c")
                .module("m1", "m1.obj", "c.c")
                .declaredNumSourceFiles(declared));

        assertEquals(List.of("a.c", "b.c"), dbi.modules().get(0).sourceFiles());
        assertEquals(List.of("c.c"), dbi.modules().get(1).sourceFiles());
    }

    @Test
    void countsMoreThan64kSourceFiles() {
        int perModule = 40_000;
        long[] offsets = new long[2 * perModule];
        for (int i = perModule; i < offsets.length; i++) {
            offsets[i] = 4;
        }
        byte[] fileInfo = DbiStreamWriter.fileInfo(2, offsets.length & 0xFFFF, new int[]{perModule, perModule},
                offsets, "a.c\0b.c\0".getBytes(StandardCharsets.UTF_8));

        DbiStream dbi = load(twoModules().fileInfo(fileInfo));

        assertEquals(80_000, dbi.getNumSourceFiles());
        assertEquals(perModule, dbi.modules().get(0).sourceFiles().size());
        assertEquals("a.c", dbi.modules().get(0).sourceFiles().get(perModule - 1));
        assertEquals("b.c", dbi.modules().get(1).sourceFiles().get(0));
    }

    @Test
    void reportsFileIndexPastOffsetsTableAsOutOfBounds() {
        byte[] fileInfo = DbiStreamWriter.fileInfo(2, 2, new int[]{1, 1}, new long[]{0, 4}, "a.c\0b.c\0".getBytes(StandardCharsets.UTF_8));
        DbiStream dbi = load(twoModules().fileInfo(fileInfo));

        RawError error = assertThrows(RawError.class, () -> dbi.getFileNameForIndex(2));
        assertEquals(RawErrorCode.INDEX_OUT_OF_BOUNDS, error.getCode());
        assertEquals(RawErrorCode.INDEX_OUT_OF_BOUNDS,
                assertThrows(RawError.class, () -> dbi.getFileNameForIndex(-1)).getCode());
    }

    @Test
    void rejectsFileNameOffsetOutsideNamesBuffer() {
        byte[] fileInfo = DbiStreamWriter.fileInfo(2, 2, new int[]{1, 1}, new long[]{0, 400}, "a.c\0b.c\0".getBytes(StandardCharsets.UTF_8));

        RawError error = loadFailure(twoModules().fileInfo(fileInfo));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
    }

    @Test
    void rejectsOffsetsTableLongerThanSubstream() {
        byte[] fileInfo = DbiStreamWriter.fileInfo(2, 0, new int[]{500, 0}, new long[0], new byte[0]);

        RawError error = loadFailure(twoModules().fileInfo(fileInfo));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
    }

    @Test
    void decodesOnlyV60ContributionsForV60Tag() {
        DbiStream dbi = load(twoModules().contributions(SectionContribVersion.VER60, 3));

        assertEquals(SectionContribVersion.VER60, dbi.getSectionContribVersion());
        assertEquals(3, dbi.getSectionContribs().size());
        assertTrue(dbi.getSectionContribs2().isEmpty());

        SectionContrib second = dbi.getSectionContribs().get(1);
        assertEquals(1, second.section());
        assertEquals(0x10, second.offset());
        assertEquals(0x20, second.size());
        assertEquals(0x60000020L, second.characteristics());
        assertEquals(1, second.imod());
        assertEquals(0xAAAA0001L, second.dataCrc());
        assertEquals(0xBBBB0001L, second.relocCrc());
    }

    @Test
    void decodesOnlyV2ContributionsForV2Tag() {
        DbiStream dbi = load(twoModules().contributions(SectionContribVersion.V2, 2));

        assertEquals(SectionContribVersion.V2, dbi.getSectionContribVersion());
        assertTrue(dbi.getSectionContribs().isEmpty());
        assertEquals(2, dbi.getSectionContribs2().size());
        assertEquals(2, dbi.getSectionContribs2().get(1).sectionCoff());
        assertEquals(1, dbi.getSectionContribs2().get(1).base().imod());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 0xEFFE0000})
    void rejectsUnknownContributionTag(int tag) {
        RawError error = loadFailure(twoModules().contributions(tag, 28, 1));

        assertEquals(RawErrorCode.FEATURE_UNSUPPORTED, error.getCode());
        assertEquals("Unsupported DBI Section Contribution version", error.getMessage());
    }

    @Test
    void rejectsPartialContributionRecord() {
        RawError error = loadFailure(twoModules().contributions(SectionContribVersion.V2, 1).contributionExtraBytes(4));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("Invalid number of bytes of section contributions", error.getMessage());
    }

    @Test
    void visitsContributionsOfEitherLayout() {
        List<String> seen = new ArrayList<>();
        SectionContribVisitor visitor = new SectionContribVisitor() {
            @Override
            public void visit(SectionContrib contrib) {
                seen.add("v60:" + contrib.imod());
            }

            @Override
            public void visit(SectionContrib2 contrib) {
                seen.add("v2:" + contrib.base().imod() + "/" + contrib.sectionCoff());
            }
        };

        load(twoModules().contributions(SectionContribVersion.VER60, 2)).visitSectionContributions(visitor);
        load(twoModules().contributions(SectionContribVersion.V2, 2)).visitSectionContributions(visitor);

        assertEquals(List.of("v60:0", "v60:1", "v2:0/1", "v2:1/2"), seen);
    }

    @Test
    void visitorWithoutV2OverloadSeesBaseRecords() {
        List<Integer> imods = new ArrayList<>();

        load(twoModules().contributions(SectionContribVersion.V2, 3))
                .visitSectionContributions(contrib -> imods.add(contrib.imod()));

        assertEquals(List.of(0, 1, 2), imods);
    }

    @Test
    void decodesSectionMap() {
        DbiStream dbi = load(twoModules().sectionMapEntries(2));

        assertEquals(2, dbi.getSectionMap().size());
        assertEquals(0x010D, dbi.getSectionMap().get(1).flags());
        assertEquals(2, dbi.getSectionMap().get(1).frame());
        assertEquals(0xFFFF, dbi.getSectionMap().get(1).secName());
        assertEquals(0x2000L, dbi.getSectionMap().get(1).secByteLength());
    }

    @Test
    void loadsSectionHeaders() {
        DbiStream dbi = load(twoModules().sectionNames(".text", ".rdata", ".longname"));

        assertEquals(List.of(".text", ".rdata", ".longnam"),
                dbi.getSectionHeaders().stream().map(s -> s.name()).toList());
        assertEquals(0x2000L, dbi.getSectionHeaders().get(1).virtualAddress());
        assertEquals(0x60000020L, dbi.getSectionHeaders().get(0).characteristics());
        assertEquals(SECTION_HEADER_STREAM, dbi.getDebugStreamIndex(DbgHeaderType.SECTION_HDR));
    }

    @Test
    void requiresSectionHeaderStream() {
        RawError error = loadFailure(twoModules()
                .debugStream(DbgHeaderType.SECTION_HDR, DbgHeaderType.INVALID_STREAM_INDEX));

        assertEquals(RawErrorCode.NO_STREAM, error.getCode());
    }

    @Test
    void rejectsSectionHeaderStreamOutOfRange() {
        RawError error = loadFailure(twoModules().debugStream(DbgHeaderType.SECTION_HDR, 99));

        assertEquals(RawErrorCode.NO_STREAM, error.getCode());
    }

    @Test
    void rejectsSectionHeaderStreamWithPartialRecord() {
        // Stream 1 is the 28-byte Info stream.
        RawError error = loadFailure(twoModules().debugStream(DbgHeaderType.SECTION_HDR, INFO_STREAM));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("Corrupted section header stream.", error.getMessage());
    }

    @Test
    void loadsFpoRecords() {
        List<FpoData> fpo = load(twoModules().fpoRecords(3)).getFpoRecords();

        assertEquals(3, fpo.size());
        FpoData last = fpo.get(2);
        assertEquals(0x1080L, last.offset());
        assertEquals(0x40L, last.size());
        assertEquals(2L, last.numLocals());
        assertEquals(3, last.numParams());
        assertEquals(5, last.prologSize());
        assertEquals(2, last.savedRegisters());
        assertTrue(last.usesBasePointer());
        assertFalse(last.hasSeh());
        assertEquals(0, last.frameType());
    }

    @Test
    void treatsMissingFpoStreamAsEmpty() {
        DbiStream dbi = load(twoModules());

        assertEquals(DbgHeaderType.INVALID_STREAM_INDEX, dbi.getDebugStreamIndex(DbgHeaderType.NEW_FPO));
        assertEquals(Collections.emptyList(), dbi.getFpoRecords());
    }

    @Test
    void rejectsFpoStreamOutOfRange() {
        RawError error = loadFailure(twoModules().debugStream(DbgHeaderType.NEW_FPO, 42));

        assertEquals(RawErrorCode.NO_STREAM, error.getCode());
    }

    @Test
    void rejectsFpoStreamWithPartialRecord() {
        // 28 bytes is not a multiple of the 16-byte record.
        RawError error = loadFailure(twoModules().debugStream(DbgHeaderType.NEW_FPO, INFO_STREAM));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("Corrupted New FPO stream.", error.getMessage());
    }

    @Test
    void acceptsWrongFpoStreamWhoseLengthIsAMultipleOfTheRecordSize() {
        // Two 40-byte section headers happen to be five FPO records long.
        DbiStream dbi = load(twoModules().debugStream(DbgHeaderType.NEW_FPO, SECTION_HEADER_STREAM));

        assertEquals(5, dbi.getFpoRecords().size());
    }

    @Test
    void readsFpoStreamPastStreamFive() {
        DbiStream dbi = load(twoModules().extraStreams(3).debugStream(DbgHeaderType.NEW_FPO, FPO_STREAM + 3));

        assertTrue(dbi.getFpoRecords().isEmpty());
    }

    @Test
    void treatsShortDebugHeaderAsAbsentSlots() {
        DbiStreamWriter writer = twoModules();
        InMemoryStreamDirectory directory = writer.directory();
        // Rebuild the stream with only six slots, ending at SECTION_HDR.
        byte[] full = writer.build();
        byte[] truncated = Arrays.copyOf(full, full.length - 10);
        ByteBuffer.wrap(truncated).order(ByteOrder.LITTLE_ENDIAN).putInt(48, 12);

        DbiStream dbi = new DbiStream(directory, ByteBuffer.wrap(truncated),
                PdbInfoStream.read(directory.getStreamBytes(INFO_STREAM)));
        dbi.reload();

        assertEquals(6, dbi.getDebugStreamIndices().length);
        assertEquals(DbgHeaderType.INVALID_STREAM_INDEX, dbi.getDebugStreamIndex(DbgHeaderType.NEW_FPO));
        assertTrue(dbi.getFpoRecords().isEmpty());
    }

    @Test
    void rejectsUnexpectedTrailingBytes() {
        // An odd debug header size leaves one byte behind.
        RawError error = loadFailure(twoModules().debugHeaderExtraBytes(1));

        assertEquals(RawErrorCode.CORRUPT_FILE, error.getCode());
        assertEquals("Found unexpected bytes in DBI Stream.", error.getMessage());
    }

    @Test
    void loadsEcNames() {
        byte[] table = DbiStreamWriter.nameTable(1, List.of("kernel32.dll", "user32.dll"));

        DbiStream dbi = load(twoModules().ecSubstream(table));

        NameHashTable names = dbi.getECNames();
        assertEquals(2, names.getNameCount());
        assertEquals("user32.dll", names.getStringForId(names.getIdForString("user32.dll")));
        assertEquals(table.length, dbi.getECSubstream().remaining());
    }

    @Test
    void propagatesEcLoaderFailure() {
        byte[] table = DbiStreamWriter.nameTable(1, List.of("a"));
        table[0] = 0;

        RawError error = loadFailure(twoModules().ecSubstream(table));

        assertEquals("Invalid hash table signature", error.getMessage());
    }

    @Test
    void exposesTypeServerMapUndecoded() {
        DbiStream dbi = load(twoModules().typeServerMap(new byte[]{1, 2, 3, 4}));

        ByteBuffer map = dbi.getTypeServerMapSubstream();
        assertEquals(4, map.remaining());
        assertEquals(0x04030201, map.getInt());
    }

    @Test
    void leavesNothingPopulatedAfterFailure() {
        DbiStream dbi = open(twoModules().age(99));

        assertThrows(RawError.class, dbi::reload);

        assertEquals(DbiStream.State.FAILED, dbi.getState());
        assertThrows(IllegalStateException.class, dbi::getHeader);
        assertThrows(IllegalStateException.class, dbi::modules);
    }

    @Test
    void refusesAccessBeforeReload() {
        DbiStream dbi = open(twoModules());

        assertEquals(DbiStream.State.UNLOADED, dbi.getState());
        assertThrows(IllegalStateException.class, dbi::getFpoRecords);
    }

    @Test
    void refusesSecondReload() {
        DbiStream dbi = load(twoModules());

        assertThrows(IllegalStateException.class, dbi::reload);
        assertEquals(DbiStream.State.READY, dbi.getState());
    }

    @Test
    void modulesAreImmutable() {
        DbiStream dbi = load(new DbiStreamWriter().module("m", "m.obj", "m.c"));

        assertThrows(UnsupportedOperationException.class, () -> dbi.modules().get(0).sourceFiles().add("x.c"));
        assertThrows(UnsupportedOperationException.class, () -> dbi.modules().clear());
    }

    @Test
    void commitDoesNothing() {
        DbiStream dbi = load(twoModules());

        dbi.commit();

        assertEquals(DbiStream.State.READY, dbi.getState());
    }

    @Test
    void readyStreamIsReadableFromOtherThreads() throws Exception {
        DbiStream dbi = open(twoModules().fpoRecords(3));
        ExecutorService loader = Executors.newSingleThreadExecutor();
        ExecutorService readers = Executors.newFixedThreadPool(4);
        try {
            loader.submit(dbi::reload).get();

            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(readers.submit(() -> dbi.modules().size() + dbi.getFpoRecords().size()));
            }
            for (Future<Integer> result : results) {
                assertEquals(5, result.get());
            }
        } finally {
            loader.shutdownNow();
            readers.shutdownNow();
        }
    }
}
