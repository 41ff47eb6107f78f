package com.bomassembler.core.writer;

/**
 * Thrown when a document cannot be encoded or written. No guarantee is made about partial output.
 */
public class BomWriteException extends RuntimeException {

    public BomWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
