package com.goerdes.pdbdbi.msf;

import com.goerdes.pdbdbi.exception.RawError;
import com.goerdes.pdbdbi.exception.RawErrorCode;
import com.goerdes.pdbdbi.utils.ByteUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static java.util.Objects.requireNonNull;

/**
 * Stream directory over streams that are already resident in memory.
 * <p>
 * A directory can be read from a ZIP "stream bundle": every non-directory
 * entry whose file name (without extension) is a decimal number becomes
 * the stream with that number, e.g. {@code 3}, {@code streams/3} or
 * {@code 3.bin}. Numbers that have no entry are empty streams.
 */
public class InMemoryStreamDirectory implements StreamDirectory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStreamDirectory.class);

    /** Stream numbers are 16-bit, 0xFFFF marks an absent stream. */
    private static final int MAX_STREAM_INDEX = 0xFFFE;

    private final List<byte[]> streams;

    public InMemoryStreamDirectory(List<byte[]> streams) {
        this.streams = List.copyOf(requireNonNull(streams, "Streams must not be null"));
    }

    /**
     * Reads a stream bundle from a ZIP archive.
     *
     * @param archive the ZIP content; closed once the archive has been read
     * @return a directory holding one stream per numbered entry
     * @throws IOException if the archive cannot be read
     */
    public static InMemoryStreamDirectory fromZip(InputStream archive) throws IOException {
        TreeMap<Integer, byte[]> numbered = new TreeMap<>();
        try (ZipInputStream zis = new ZipInputStream(archive)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    Integer index = streamNumber(entry.getName());
                    if (index == null) {
                        log.debug("Skipping bundle entry '{}', not a stream number", entry.getName());
                    } else if (numbered.put(index, zis.readAllBytes()) != null) {
                        throw RawError.corrupt("Stream " + index + " appears twice in the bundle.");
                    }
                }
                zis.closeEntry();
            }
        }

        int count = numbered.isEmpty() ? 0 : numbered.lastKey() + 1;
        List<byte[]> streams = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            streams.add(numbered.getOrDefault(i, new byte[0]));
        }
        log.debug("Read {} streams from bundle", count);
        return new InMemoryStreamDirectory(streams);
    }

    /** Parses the stream number out of an entry name, or returns null. */
    private static Integer streamNumber(String entryName) {
        String name = entryName.substring(entryName.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        if (dot >= 0) {
            name = name.substring(0, dot);
        }
        if (name.isEmpty() || !name.chars().allMatch(Character::isDigit)) {
            return null;
        }
        if (name.length() > 5) {
            return null;
        }
        int index = Integer.parseInt(name);
        return index <= MAX_STREAM_INDEX ? index : null;
    }

    @Override
    public int getNumStreams() {
        return streams.size();
    }

    @Override
    public long getStreamLength(int streamIndex) {
        return stream(streamIndex).length;
    }

    @Override
    public ByteBuffer getStreamBytes(int streamIndex) {
        return ByteUtils.littleEndian(stream(streamIndex));
    }

    private byte[] stream(int streamIndex) {
        if (streamIndex < 0 || streamIndex >= streams.size()) {
            throw new RawError(RawErrorCode.NO_STREAM,
                    "Stream " + streamIndex + " does not exist, the directory has " + streams.size() + " streams.");
        }
        return streams.get(streamIndex);
    }
}
