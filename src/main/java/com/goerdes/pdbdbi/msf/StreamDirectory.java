package com.goerdes.pdbdbi.msf;

import java.nio.ByteBuffer;

/**
 * Maps logical stream numbers of a PDB container to contiguous byte ranges.
 */
public interface StreamDirectory {

    /**
     * @return the number of streams, valid stream numbers are {@code [0, getNumStreams())}
     */
    int getNumStreams();

    /**
     * Returns the byte length of a stream.
     *
     * @param streamIndex the stream number
     * @return the stream length in bytes
     * @throws com.goerdes.pdbdbi.exception.RawError with {@code NO_STREAM} for an unknown stream number
     */
    long getStreamLength(int streamIndex);

    /**
     * Returns a read-only little-endian view of a stream, positioned at zero.
     *
     * @param streamIndex the stream number
     * @return the stream content
     * @throws com.goerdes.pdbdbi.exception.RawError with {@code NO_STREAM} for an unknown stream number
     */
    ByteBuffer getStreamBytes(int streamIndex);

}
