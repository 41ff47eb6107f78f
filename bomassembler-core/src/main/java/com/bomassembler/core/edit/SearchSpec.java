package com.bomassembler.core.edit;

import java.util.Objects;

/**
 * Locates the subject of an edit.
 *
 * @param subject subject kind
 * @param name component name, used by {@link SubjectKind#COMPONENT_NAME_VERSION}
 * @param version component version, optional
 */
public record SearchSpec(SubjectKind subject, String name, String version) {

    public SearchSpec {
        Objects.requireNonNull(subject, "subject must not be null");
    }

    public static SearchSpec document() {
        return new SearchSpec(SubjectKind.DOCUMENT, null, null);
    }

    public static SearchSpec primaryComponent() {
        return new SearchSpec(SubjectKind.PRIMARY_COMPONENT, null, null);
    }

    public static SearchSpec component(String name, String version) {
        return new SearchSpec(SubjectKind.COMPONENT_NAME_VERSION, name, version);
    }
}
