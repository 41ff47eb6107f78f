package com.bomassembler.core.model;

import java.util.Optional;

/**
 * Relationship kinds of the SPDX 2.3 vocabulary.
 *
 * <p>Kinds the vocabulary does not know are read as {@link #OTHER}; see {@link Relationship}.
 */
public enum RelationshipType {
    /** The source element describes the target (document to its subject). */
    DESCRIBES,
    DESCRIBED_BY,

    /** The source element contains the target. */
    CONTAINS,
    CONTAINED_BY,

    DEPENDS_ON,
    DEPENDENCY_OF,
    DEPENDENCY_MANIFEST_OF,
    BUILD_DEPENDENCY_OF,
    DEV_DEPENDENCY_OF,
    OPTIONAL_DEPENDENCY_OF,
    PROVIDED_DEPENDENCY_OF,
    TEST_DEPENDENCY_OF,
    RUNTIME_DEPENDENCY_OF,
    EXAMPLE_OF,
    GENERATES,
    GENERATED_FROM,
    ANCESTOR_OF,
    DESCENDANT_OF,
    VARIANT_OF,
    DISTRIBUTION_ARTIFACT,
    PATCH_FOR,
    PATCH_APPLIED,
    COPY_OF,
    FILE_ADDED,
    FILE_DELETED,
    FILE_MODIFIED,
    EXPANDED_FROM_ARCHIVE,
    DYNAMIC_LINK,
    STATIC_LINK,
    DATA_FILE_OF,
    TEST_CASE_OF,
    BUILD_TOOL_OF,
    DEV_TOOL_OF,
    TEST_OF,
    TEST_TOOL_OF,
    DOCUMENTATION_OF,
    OPTIONAL_COMPONENT_OF,
    METAFILE_OF,
    PACKAGE_OF,
    AMENDS,
    PREREQUISITE_FOR,
    HAS_PREREQUISITE,
    REQUIREMENT_DESCRIPTION_FOR,
    SPECIFICATION_FOR,

    /** Open bucket for anything else. */
    OTHER;

    /**
     * Exact lookup of a serialized kind.
     *
     * @param token kind as written in a document, e.g. {@code DEPENDS_ON}
     * @return matching kind, empty if the token is not in the vocabulary
     */
    public static Optional<RelationshipType> fromToken(String token) {
        for (RelationshipType type : values()) {
            if (type.name().equals(token)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
