package com.bomassembler.core.merge;

/**
 * Thrown when a component cannot be copied during merge. The component is skipped.
 */
public class ComponentCopyException extends Exception {

    public ComponentCopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
