package com.bomassembler.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Checksum algorithms known to SPDX 2.3, with their serialized tokens.
 */
public enum ChecksumAlgorithm {
    SHA1("SHA1"),
    SHA224("SHA224"),
    SHA256("SHA256"),
    SHA384("SHA384"),
    SHA512("SHA512"),
    SHA3_256("SHA3-256"),
    SHA3_384("SHA3-384"),
    SHA3_512("SHA3-512"),
    BLAKE2B_256("BLAKE2b-256"),
    BLAKE2B_384("BLAKE2b-384"),
    BLAKE2B_512("BLAKE2b-512"),
    BLAKE3("BLAKE3"),
    MD2("MD2"),
    MD4("MD4"),
    MD5("MD5"),
    MD6("MD6"),
    ADLER32("ADLER32");

    private final String token;

    ChecksumAlgorithm(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * Finds an algorithm by a loosely written name. Case, dashes and underscores are ignored,
     * so {@code sha-256}, {@code SHA_256} and {@code SHA256} all resolve to {@link #SHA256}.
     *
     * @param name algorithm name
     * @return matching algorithm, empty if unknown
     */
    public static Optional<ChecksumAlgorithm> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = normalize(name);
        for (ChecksumAlgorithm algorithm : values()) {
            if (normalize(algorithm.token).equals(key)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String name) {
        return name.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
    }
}
