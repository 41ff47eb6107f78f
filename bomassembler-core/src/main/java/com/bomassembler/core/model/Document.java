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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root container of a bill-of-materials document (SPDX 2.3 JSON layout).
 *
 * <p>Files, extracted ("other") license records and external document references are carried
 * as opaque JSON trees. The engines never look inside them, they only pass them through. Top-level
 * sections the record does not model ({@code snippets}, {@code annotations}, ...) are kept in
 * {@link #extensions()} and written back unchanged.
 *
 * @param spdxVersion format/version string (e.g. {@code SPDX-2.3})
 * @param dataLicense data license of the document itself
 * @param spdxId element identifier of the document ({@code SPDXRef-DOCUMENT})
 * @param name document name
 * @param namespace unique document namespace URI
 * @param creationInfo creation metadata, may be null in loosely produced documents
 * @param externalDocumentRefs external document references (opaque)
 * @param components packages inventoried by this document, in document order
 * @param files file records (opaque)
 * @param relationships relationships between elements, in document order
 * @param otherLicenses extracted licensing info records (opaque)
 * @param comment document-level free-text comment
 * @param extensions top-level properties this record does not model
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"spdxVersion", "dataLicense", "SPDXID", "name", "documentNamespace", "creationInfo",
    "comment", "externalDocumentRefs", "packages", "files", "hasExtractedLicensingInfos", "relationships"})
public record Document(
    @JsonProperty("spdxVersion") String spdxVersion,
    @JsonProperty("dataLicense") String dataLicense,
    @JsonProperty("SPDXID") String spdxId,
    @JsonProperty("name") String name,
    @JsonProperty("documentNamespace") String namespace,
    @JsonProperty("creationInfo") CreationInfo creationInfo,
    @JsonProperty("externalDocumentRefs") List<JsonNode> externalDocumentRefs,
    @JsonProperty("packages") List<Component> components,
    @JsonProperty("files") List<JsonNode> files,
    @JsonProperty("relationships") List<Relationship> relationships,
    @JsonProperty("hasExtractedLicensingInfos") List<JsonNode> otherLicenses,
    @JsonProperty("comment") String comment,
    @JsonIgnore Map<String, JsonNode> extensions
) {
    /** Element identifier every SPDX document uses for itself. */
    public static final String DOCUMENT_ID = "SPDXRef-DOCUMENT";

    /**
     * Compact constructor with defaults.
     */
    public Document {
        if (spdxId == null) {
            spdxId = DOCUMENT_ID;
        }
        if (externalDocumentRefs == null) {
            externalDocumentRefs = List.of();
        }
        if (components == null) {
            components = List.of();
        }
        if (files == null) {
            files = List.of();
        }
        if (relationships == null) {
            relationships = List.of();
        }
        if (otherLicenses == null) {
            otherLicenses = List.of();
        }
        extensions = extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions);
    }

    public Document(String spdxVersion, String dataLicense, String spdxId, String name, String namespace,
                    CreationInfo creationInfo, List<JsonNode> externalDocumentRefs, List<Component> components,
                    List<JsonNode> files, List<Relationship> relationships, List<JsonNode> otherLicenses,
                    String comment) {
        this(spdxVersion, dataLicense, spdxId, name, namespace, creationInfo, externalDocumentRefs, components,
            files, relationships, otherLicenses, comment, null);
    }

    @JsonCreator
    static Document fromJson(
        @JsonProperty("spdxVersion") String spdxVersion,
        @JsonProperty("dataLicense") String dataLicense,
        @JsonProperty("SPDXID") String spdxId,
        @JsonProperty("name") String name,
        @JsonProperty("documentNamespace") String namespace,
        @JsonProperty("creationInfo") CreationInfo creationInfo,
        @JsonProperty("externalDocumentRefs") List<JsonNode> externalDocumentRefs,
        @JsonProperty("packages") List<Component> components,
        @JsonProperty("files") List<JsonNode> files,
        @JsonProperty("relationships") List<Relationship> relationships,
        @JsonProperty("hasExtractedLicensingInfos") List<JsonNode> otherLicenses,
        @JsonProperty("comment") String comment
    ) {
        return new Document(spdxVersion, dataLicense, spdxId, name, namespace, creationInfo,
            externalDocumentRefs, components, files, relationships, otherLicenses, comment, null);
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
     * Looks up a component by its element identifier.
     *
     * @param id element identifier
     * @return the first component with that identifier
     */
    public Optional<Component> findComponent(String id) {
        return components.stream()
            .filter(c -> c.id().equals(id))
            .findFirst();
    }

    public Document withDataLicense(String value) {
        return new Document(spdxVersion, value, spdxId, name, namespace, creationInfo,
            externalDocumentRefs, components, files, relationships, otherLicenses, comment, extensions);
    }

    public Document withCreationInfo(CreationInfo value) {
        return new Document(spdxVersion, dataLicense, spdxId, name, namespace, value,
            externalDocumentRefs, components, files, relationships, otherLicenses, comment, extensions);
    }

    public Document withComponents(List<Component> value) {
        return new Document(spdxVersion, dataLicense, spdxId, name, namespace, creationInfo,
            externalDocumentRefs, value, files, relationships, otherLicenses, comment, extensions);
    }

    public Document withComment(String value) {
        return new Document(spdxVersion, dataLicense, spdxId, name, namespace, creationInfo,
            externalDocumentRefs, components, files, relationships, otherLicenses, value, extensions);
    }
}
