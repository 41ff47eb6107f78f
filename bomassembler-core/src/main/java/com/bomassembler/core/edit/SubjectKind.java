package com.bomassembler.core.edit;

import java.util.Locale;

/**
 * What an edit targets.
 */
public enum SubjectKind {
    /** The document itself. */
    DOCUMENT("document"),

    /** The component the document's DESCRIBES relationship points at. */
    PRIMARY_COMPONENT("primary-component"),

    /** The first component matching a name and, optionally, a version. */
    COMPONENT_NAME_VERSION("component-name-version");

    private final String id;

    SubjectKind(String id) {
        this.id = id;
    }

    /**
     * Returns the identifier used on the command line.
     *
     * @return identifier such as {@code primary-component}
     */
    public String id() {
        return id;
    }

    /**
     * Parses a command-line identifier.
     *
     * @param value identifier, case-insensitive
     * @return matching subject kind
     * @throws IllegalArgumentException if the value is unknown
     */
    public static SubjectKind fromId(String value) {
        String key = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (SubjectKind kind : values()) {
            if (kind.id.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown subject: " + value
            + " (expected document, primary-component or component-name-version)");
    }

    @Override
    public String toString() {
        return id;
    }
}
