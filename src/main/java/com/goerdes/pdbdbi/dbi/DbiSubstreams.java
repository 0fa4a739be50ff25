package com.goerdes.pdbdbi.dbi;

import com.goerdes.pdbdbi.model.DbiHeader;
import com.goerdes.pdbdbi.utils.BinaryStreamReader;

import java.nio.ByteBuffer;

/**
 * The regions of the DBI stream that follow the header, in file order.
 *
 * @param modInfo       module info records
 * @param secContr      section contributions
 * @param secMap        section map
 * @param fileInfo      per-module source file names
 * @param typeServerMap type server map, not decoded further
 * @param ec            EC name table
 * @param debugStreams  the optional debug header array
 */
record DbiSubstreams(
        ByteBuffer modInfo,
        ByteBuffer secContr,
        ByteBuffer secMap,
        ByteBuffer fileInfo,
        ByteBuffer typeServerMap,
        ByteBuffer ec,
        DebugStreamTable debugStreams
) {

    /**
     * Slices the substreams off {@code reader} using the sizes declared in
     * {@code header}. Any bytes left afterwards stay in the reader.
     */
    static DbiSubstreams segment(BinaryStreamReader reader, DbiHeader header) {
        ByteBuffer modInfo = reader.readSubstream(header.modiSubstreamSize());
        ByteBuffer secContr = reader.readSubstream(header.secContrSubstreamSize());
        ByteBuffer secMap = reader.readSubstream(header.sectionMapSize());
        ByteBuffer fileInfo = reader.readSubstream(header.fileInfoSize());
        ByteBuffer typeServerMap = reader.readSubstream(header.typeServerSize());
        ByteBuffer ec = reader.readSubstream(header.ecSubstreamSize());
        int[] debugStreams = reader.readUInt16Array(header.optionalDbgHdrSize() / Short.BYTES);
        return new DbiSubstreams(modInfo, secContr, secMap, fileInfo, typeServerMap, ec,
                new DebugStreamTable(debugStreams));
    }
}
