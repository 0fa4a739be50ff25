package com.goerdes.pdbdbi.msf;

import java.nio.ByteBuffer;

/**
 * Decodes a serialized name hash table, such as the DBI stream's EC substream.
 */
@FunctionalInterface
public interface NameTableLoader {

    /**
     * @param bytes the serialized table
     * @return the decoded table
     * @throws com.goerdes.pdbdbi.exception.RawError if the bytes do not form a valid table
     */
    NameHashTable load(ByteBuffer bytes);

}
