package com.goerdes.pdbdbi.exception;

/**
 * Base failure raised while reading or decoding an uploaded PDB bundle.
 */
public class FileProcessingException extends RuntimeException {

    public FileProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
