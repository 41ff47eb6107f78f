package com.bomassembler.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed relationship between two element identifiers.
 *
 * <p>Either endpoint may name the document itself, a component or a file. A kind outside the
 * SPDX 2.3 vocabulary reads as {@link RelationshipType#OTHER}; its original token is kept in
 * {@link #declaredType()} and written back as it was.
 *
 * @param refA source element identifier
 * @param refB target element identifier
 * @param type relationship kind
 * @param comment optional comment
 * @param declaredType kind token as read, only set when {@code type} could not represent it
 * @param extensions properties this record does not model, written back unchanged
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"spdxElementId", "relatedSpdxElement", "relationshipType", "comment"})
public record Relationship(
    @JsonProperty("spdxElementId") String refA,
    @JsonProperty("relatedSpdxElement") String refB,
    @JsonIgnore RelationshipType type,
    @JsonProperty("comment") String comment,
    @JsonIgnore String declaredType,
    @JsonIgnore Map<String, JsonNode> extensions
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(refA, "refA must not be null");
        Objects.requireNonNull(refB, "refB must not be null");
        Objects.requireNonNull(type, "type must not be null");
        extensions = extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions);
    }

    public Relationship(String refA, String refB, RelationshipType type, String comment) {
        this(refA, refB, type, comment, null, null);
    }

    @JsonCreator
    static Relationship fromJson(
        @JsonProperty("spdxElementId") String refA,
        @JsonProperty("relatedSpdxElement") String refB,
        @JsonProperty("relationshipType") String relationshipType,
        @JsonProperty("comment") String comment
    ) {
        Objects.requireNonNull(relationshipType, "relationshipType must not be null");
        RelationshipType type = RelationshipType.fromToken(relationshipType).orElse(RelationshipType.OTHER);
        String declared = type.name().equals(relationshipType) ? null : relationshipType;
        return new Relationship(refA, refB, type, comment, declared, null);
    }

    public static Relationship of(String refA, RelationshipType type, String refB) {
        return new Relationship(refA, refB, type, null);
    }

    /**
     * Kind token as written to documents.
     *
     * @return the declared token when one was kept, otherwise the name of {@link #type()}
     */
    @JsonProperty("relationshipType")
    public String relationshipType() {
        return declaredType != null ? declaredType : type.name();
    }

    @Override
    @JsonIgnore
    public Map<String, JsonNode> extensions() {
        return Collections.unmodifiableMap(extensions);
    }

    @JsonAnySetter
    void putExtension(String property, JsonNode value) {
        extensions.put(property, value);
    }

    @JsonAnyGetter
    Map<String, JsonNode> jsonExtensions() {
        return extensions;
    }

    /**
     * Replaces every endpoint equal to {@code from} with {@code to}. Both endpoints are checked
     * independently.
     *
     * @param from identifier to replace
     * @param to replacement identifier
     * @return this relationship if no endpoint matched, otherwise a rewritten copy
     */
    public Relationship rewrite(String from, String to) {
        boolean matchA = refA.equals(from);
        boolean matchB = refB.equals(from);
        if (!matchA && !matchB) {
            return this;
        }
        return new Relationship(matchA ? to : refA, matchB ? to : refB, type, comment, declaredType, extensions);
    }

    /**
     * Checks whether either endpoint equals the given identifier.
     *
     * @param id element identifier
     * @return true if {@code refA} or {@code refB} is {@code id}
     */
    public boolean references(String id) {
        return refA.equals(id) || refB.equals(id);
    }
}
