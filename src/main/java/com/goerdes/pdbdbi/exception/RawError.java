package com.goerdes.pdbdbi.exception;

import lombok.Getter;

/**
 * Decode failure tagged with a {@link RawErrorCode}. The message names the
 * check that failed, falling back to the code's default message.
 */
@Getter
public class RawError extends FileProcessingException {

    private final RawErrorCode code;

    public RawError(RawErrorCode code) {
        this(code, code.defaultMessage());
    }

    public RawError(RawErrorCode code, String message) {
        super(message, null);
        this.code = code;
    }

    public static RawError corrupt(String message) {
        return new RawError(RawErrorCode.CORRUPT_FILE, message);
    }

    public static RawError unsupported(String message) {
        return new RawError(RawErrorCode.FEATURE_UNSUPPORTED, message);
    }
}
