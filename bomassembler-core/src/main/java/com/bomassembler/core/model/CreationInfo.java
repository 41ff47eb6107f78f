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

/**
 * Creation metadata of a document.
 *
 * @param created UTC creation timestamp ({@code yyyy-MM-ddTHH:mm:ssZ})
 * @param creators creators of the document, in order
 * @param comment creator comment
 * @param licenseListVersion version of the SPDX license list the document was produced with
 * @param extensions properties this record does not model, written back unchanged
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"created", "creators", "comment", "licenseListVersion"})
public record CreationInfo(
    @JsonProperty("created") String created,
    @JsonProperty("creators") List<Creator> creators,
    @JsonProperty("comment") String comment,
    @JsonProperty("licenseListVersion") String licenseListVersion,
    @JsonIgnore Map<String, JsonNode> extensions
) {
    public CreationInfo {
        extensions = extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions);
    }

    public CreationInfo(String created, List<Creator> creators, String comment, String licenseListVersion) {
        this(created, creators, comment, licenseListVersion, null);
    }

    @JsonCreator
    static CreationInfo fromJson(
        @JsonProperty("created") String created,
        @JsonProperty("creators") List<Creator> creators,
        @JsonProperty("comment") String comment,
        @JsonProperty("licenseListVersion") String licenseListVersion
    ) {
        return new CreationInfo(created, creators, comment, licenseListVersion, null);
    }

    public static CreationInfo empty() {
        return new CreationInfo(null, null, null, null);
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

    public CreationInfo withCreated(String value) {
        return new CreationInfo(value, creators, comment, licenseListVersion, extensions);
    }

    public CreationInfo withCreators(List<Creator> value) {
        return new CreationInfo(created, value, comment, licenseListVersion, extensions);
    }

    public CreationInfo withComment(String value) {
        return new CreationInfo(created, creators, value, licenseListVersion, extensions);
    }
}
