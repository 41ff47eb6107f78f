package com.bomassembler.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One inventoried entry (package or module) of a document.
 *
 * @param id element identifier, unique within the owning document
 * @param name component name
 * @param version component version
 * @param supplier supplier, null when the document does not state one
 * @param downloadLocation download or repository location
 * @param filesAnalyzed whether the files of the component were analyzed
 * @param checksums checksums of the component artifact
 * @param licenseConcluded concluded license expression
 * @param licenseDeclared declared license expression
 * @param copyright copyright text
 * @param description free-text description
 * @param externalReferences typed external locators (purl, cpe, ...)
 * @param primaryPurpose primary purpose tag, null when unset
 * @param extensions package properties this record does not model (homepage, originator,
 *                   annotations, ...), written back unchanged
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"SPDXID", "name", "versionInfo", "supplier", "downloadLocation", "filesAnalyzed",
    "checksums", "licenseConcluded", "licenseDeclared", "copyrightText", "description",
    "externalRefs", "primaryPackagePurpose"})
public record Component(
    @JsonProperty("SPDXID") String id,
    @JsonProperty("name") String name,
    @JsonProperty("versionInfo") String version,
    @JsonProperty("supplier") Supplier supplier,
    @JsonProperty("downloadLocation") String downloadLocation,
    @JsonProperty("filesAnalyzed") Boolean filesAnalyzed,
    @JsonProperty("checksums") List<Checksum> checksums,
    @JsonProperty("licenseConcluded") String licenseConcluded,
    @JsonProperty("licenseDeclared") String licenseDeclared,
    @JsonProperty("copyrightText") String copyright,
    @JsonProperty("description") String description,
    @JsonProperty("externalRefs") List<ExternalReference> externalReferences,
    @JsonProperty("primaryPackagePurpose") PrimaryPurpose primaryPurpose,
    @JsonIgnore Map<String, JsonNode> extensions
) {
    static final String PRIMARY_PURPOSE = "primaryPackagePurpose";

    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(id, "id must not be null");
        if (checksums == null) {
            checksums = List.of();
        }
        if (externalReferences == null) {
            externalReferences = List.of();
        }
        extensions = extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions);
    }

    public Component(String id, String name, String version, Supplier supplier, String downloadLocation,
                     Boolean filesAnalyzed, List<Checksum> checksums, String licenseConcluded,
                     String licenseDeclared, String copyright, String description,
                     List<ExternalReference> externalReferences, PrimaryPurpose primaryPurpose) {
        this(id, name, version, supplier, downloadLocation, filesAnalyzed, checksums, licenseConcluded,
            licenseDeclared, copyright, description, externalReferences, primaryPurpose, null);
    }

    /**
     * JSON entry point. A purpose token outside the vocabulary is kept verbatim as an extension
     * and {@link #primaryPurpose()} stays null.
     */
    @JsonCreator
    static Component fromJson(
        @JsonProperty("SPDXID") String id,
        @JsonProperty("name") String name,
        @JsonProperty("versionInfo") String version,
        @JsonProperty("supplier") Supplier supplier,
        @JsonProperty("downloadLocation") String downloadLocation,
        @JsonProperty("filesAnalyzed") Boolean filesAnalyzed,
        @JsonProperty("checksums") List<Checksum> checksums,
        @JsonProperty("licenseConcluded") String licenseConcluded,
        @JsonProperty("licenseDeclared") String licenseDeclared,
        @JsonProperty("copyrightText") String copyright,
        @JsonProperty("description") String description,
        @JsonProperty("externalRefs") List<ExternalReference> externalReferences,
        @JsonProperty(PRIMARY_PURPOSE) String primaryPurpose
    ) {
        Map<String, JsonNode> extensions = new LinkedHashMap<>();
        Optional<PrimaryPurpose> purpose = PrimaryPurpose.fromToken(primaryPurpose);
        if (purpose.isEmpty() && primaryPurpose != null) {
            extensions.put(PRIMARY_PURPOSE, TextNode.valueOf(primaryPurpose));
        }
        return new Component(id, name, version, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences,
            purpose.orElse(null), extensions);
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
     * Checks whether at least one external reference of the given type is attached.
     *
     * @param referenceType reference type, compared exactly (e.g. {@code purl})
     * @return true if a reference of that type exists
     */
    public boolean hasExternalReference(String referenceType) {
        return externalReferences.stream().anyMatch(ref -> ref.hasType(referenceType));
    }

    public Component withId(String value) {
        return new Component(value, name, version, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withName(String value) {
        return new Component(id, value, version, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withVersion(String value) {
        return new Component(id, name, value, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withSupplier(Supplier value) {
        return new Component(id, name, version, value, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withDownloadLocation(String value) {
        return new Component(id, name, version, supplier, value, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withChecksums(List<Checksum> value) {
        return new Component(id, name, version, supplier, downloadLocation, filesAnalyzed, value,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withLicenseConcluded(String value) {
        return new Component(id, name, version, supplier, downloadLocation, filesAnalyzed, checksums,
            value, licenseDeclared, copyright, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withCopyright(String value) {
        return new Component(id, name, version, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, value, description, externalReferences, primaryPurpose, extensions);
    }

    public Component withDescription(String value) {
        return new Component(id, name, version, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, value, externalReferences, primaryPurpose, extensions);
    }

    public Component withExternalReferences(List<ExternalReference> value) {
        return new Component(id, name, version, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, value, primaryPurpose, extensions);
    }

    public Component withPrimaryPurpose(PrimaryPurpose value) {
        Map<String, JsonNode> rest = new LinkedHashMap<>(extensions);
        rest.remove(PRIMARY_PURPOSE);
        return new Component(id, name, version, supplier, downloadLocation, filesAnalyzed, checksums,
            licenseConcluded, licenseDeclared, copyright, description, externalReferences, value, rest);
    }
}
