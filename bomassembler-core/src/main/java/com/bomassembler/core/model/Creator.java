package com.bomassembler.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A typed document creator, serialized as {@code "<Type>: <name>"}.
 *
 * @param type creator type
 * @param name display string (e.g. {@code "Jane Doe (jane@example.com)"} or {@code "bomassembler-1.0.0"})
 */
public record Creator(CreatorType type, String name) {

    public Creator {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Creator person(String name) {
        return new Creator(CreatorType.PERSON, name);
    }

    public static Creator organization(String name) {
        return new Creator(CreatorType.ORGANIZATION, name);
    }

    public static Creator tool(String name) {
        return new Creator(CreatorType.TOOL, name);
    }

    /**
     * Parses the serialized form.
     *
     * @param value value such as {@code "Tool: syft-0.90.0"}
     * @return parsed creator
     * @throws IllegalArgumentException if the value has no type prefix or an unknown type
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Creator parse(String value) {
        int colon = value == null ? -1 : value.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Creator must have the form '<Type>: <name>': " + value);
        }
        CreatorType type = CreatorType.fromLabel(value.substring(0, colon).trim());
        return new Creator(type, value.substring(colon + 1).trim());
    }

    @JsonValue
    public String spdxValue() {
        return type.label() + ": " + name;
    }
}
