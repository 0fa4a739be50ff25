package com.goerdes.pdbdbi.components;

import com.goerdes.pdbdbi.dbi.DbiStream;
import com.goerdes.pdbdbi.msf.InfoStream;
import com.goerdes.pdbdbi.msf.NameHashTable;
import com.goerdes.pdbdbi.msf.NameTableLoader;
import com.goerdes.pdbdbi.msf.PdbInfoStream;
import com.goerdes.pdbdbi.msf.StreamDirectory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds loaded {@link DbiStream} instances out of a stream directory, using
 * the stream numbers configured in application.properties.
 */
@Component
public class DbiStreamFactory {

    private final int infoStreamIndex;
    private final int dbiStreamIndex;
    private final boolean ecNamesEnabled;

    public DbiStreamFactory(@Value("${dbi.info-stream-index:1}") int infoStreamIndex,
                            @Value("${dbi.dbi-stream-index:3}") int dbiStreamIndex,
                            @Value("${dbi.ec-names.enabled:true}") boolean ecNamesEnabled) {
        this.infoStreamIndex = infoStreamIndex;
        this.dbiStreamIndex = dbiStreamIndex;
        this.ecNamesEnabled = ecNamesEnabled;
    }

    /**
     * Reads the Info stream, then decodes the DBI stream against it.
     *
     * @param directory the streams of one PDB
     * @return a DBI stream in state {@code READY}
     * @throws com.goerdes.pdbdbi.exception.RawError if either stream is missing or malformed
     */
    public DbiStream create(StreamDirectory directory) {
        InfoStream info = PdbInfoStream.read(directory.getStreamBytes(infoStreamIndex));
        NameTableLoader ecLoader = ecNamesEnabled ? NameHashTable::load : bytes -> NameHashTable.empty();

        DbiStream dbi = new DbiStream(directory, directory.getStreamBytes(dbiStreamIndex), info, ecLoader);
        dbi.reload();
        return dbi;
    }
}
