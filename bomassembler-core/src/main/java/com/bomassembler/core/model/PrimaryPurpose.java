package com.bomassembler.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed vocabulary of component primary purposes.
 */
public enum PrimaryPurpose {
    APPLICATION("APPLICATION"),
    FRAMEWORK("FRAMEWORK"),
    LIBRARY("LIBRARY"),
    CONTAINER("CONTAINER"),
    OPERATING_SYSTEM("OPERATING-SYSTEM"),
    DEVICE("DEVICE"),
    FIRMWARE("FIRMWARE"),
    SOURCE("SOURCE"),
    ARCHIVE("ARCHIVE"),
    FILE("FILE"),
    INSTALL("INSTALL"),
    OTHER("OTHER");

    private final String token;

    PrimaryPurpose(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Case-insensitive lookup; {@code _} and {@code -} are interchangeable.
     *
     * @param value purpose name such as {@code library} or {@code operating_system}
     * @return matching purpose, empty if the value is not in the vocabulary
     */
    public static Optional<PrimaryPurpose> lookup(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = value.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        for (PrimaryPurpose purpose : values()) {
            if (purpose.token.equals(key)) {
                return Optional.of(purpose);
            }
        }
        return Optional.empty();
    }

    /**
     * Exact lookup of the serialized token, as found in documents.
     *
     * @param token token such as {@code OPERATING-SYSTEM}
     * @return matching purpose, empty for null or unknown tokens
     */
    public static Optional<PrimaryPurpose> fromToken(String token) {
        for (PrimaryPurpose purpose : values()) {
            if (purpose.token.equals(token)) {
                return Optional.of(purpose);
            }
        }
        return Optional.empty();
    }
}
