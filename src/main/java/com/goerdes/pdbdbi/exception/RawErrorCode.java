package com.goerdes.pdbdbi.exception;

/**
 * Classifies why decoding a raw PDB stream failed.
 */
public enum RawErrorCode {

    /** A structural invariant of the stream does not hold. */
    CORRUPT_FILE("The PDB file is corrupt."),

    /** The data uses a known format version this reader does not handle. */
    FEATURE_UNSUPPORTED("The feature is unsupported by the implementation."),

    /** A referenced stream does not exist in the stream directory. */
    NO_STREAM("The specified stream could not be loaded."),

    /** A computed index is outside the table it addresses. */
    INDEX_OUT_OF_BOUNDS("The specified item does not exist in the array.");

    private final String defaultMessage;

    RawErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
