package com.bomassembler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Checksum of a component artifact.
 *
 * @param algorithm SPDX algorithm token (e.g. {@code SHA256})
 * @param value hex digest
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checksum(
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("checksumValue") String value
) {
}
