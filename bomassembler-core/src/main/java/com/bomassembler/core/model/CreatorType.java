package com.bomassembler.core.model;

/**
 * Kinds of document creators.
 */
public enum CreatorType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    TOOL("Tool");

    private final String label;

    CreatorType(String label) {
        this.label = label;
    }

    /**
     * Returns the label used in the serialized {@code "<label>: <name>"} form.
     *
     * @return creator type label
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a serialized label, ignoring case.
     *
     * @param label label such as {@code Tool}
     * @return the matching type
     * @throws IllegalArgumentException if the label is unknown
     */
    public static CreatorType fromLabel(String label) {
        for (CreatorType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown creator type: " + label);
    }
}
