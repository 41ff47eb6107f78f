package com.bomassembler.core.merge;

/**
 * Thrown when input documents declare license-list versions that cannot be compared.
 */
public class LicenseListVersionException extends RuntimeException {

    public LicenseListVersionException(String message) {
        super(message);
    }
}
