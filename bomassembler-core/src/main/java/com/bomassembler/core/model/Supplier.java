package com.bomassembler.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Supplier of a component, serialized as {@code "Organization: <name>"}, {@code "Person: <name>"}
 * or {@code "NOASSERTION"}.
 *
 * @param type supplier type
 * @param name display string, {@code NOASSERTION} for the sentinel
 */
public record Supplier(SupplierType type, String name) {

    /** Sentinel meaning no supplier is asserted. */
    public static final Supplier NOASSERTION = new Supplier(SupplierType.NOASSERTION, "NOASSERTION");

    public Supplier {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Supplier organization(String name) {
        return new Supplier(SupplierType.ORGANIZATION, name);
    }

    /**
     * Parses the serialized form.
     *
     * @param value serialized supplier
     * @return parsed supplier
     * @throws IllegalArgumentException if the value is neither the sentinel nor typed
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Supplier parse(String value) {
        if (value == null || value.isBlank() || "NOASSERTION".equals(value.trim())) {
            return NOASSERTION;
        }
        int colon = value.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Supplier must have the form '<Type>: <name>': " + value);
        }
        String prefix = value.substring(0, colon).trim();
        String name = value.substring(colon + 1).trim();
        if ("Organization".equalsIgnoreCase(prefix)) {
            return new Supplier(SupplierType.ORGANIZATION, name);
        }
        if ("Person".equalsIgnoreCase(prefix)) {
            return new Supplier(SupplierType.PERSON, name);
        }
        throw new IllegalArgumentException("Unknown supplier type: " + prefix);
    }

    @JsonValue
    public String spdxValue() {
        return switch (type) {
            case ORGANIZATION -> "Organization: " + name;
            case PERSON -> "Person: " + name;
            case NOASSERTION -> "NOASSERTION";
        };
    }
}
