package com.bomassembler.core.loader;

/**
 * Thrown when a document cannot be read or parsed. Fatal for the operation that needed it.
 */
public class BomLoadException extends RuntimeException {

    public BomLoadException(String message) {
        super(message);
    }

    public BomLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
