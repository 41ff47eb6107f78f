package com.bomassembler.core.config;

import com.bomassembler.core.model.Checksum;
import com.bomassembler.core.model.ChecksumAlgorithm;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Configured checksum (algorithm name plus value).
 *
 * @param algorithm algorithm name as written by the user, e.g. {@code sha-256}
 * @param value hex digest, entries with an empty value are dropped
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HashSpec(
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("value") String value
) {
    /**
     * Converts configured hashes to checksums, normalizing algorithm names and dropping entries
     * without a value.
     *
     * @param specs configured hashes, may be null
     * @return checksums in configuration order
     */
    public static List<Checksum> toChecksums(List<HashSpec> specs) {
        if (specs == null) {
            return List.of();
        }
        return specs.stream()
            .filter(spec -> spec.value() != null && !spec.value().isEmpty())
            .map(HashSpec::toChecksum)
            .toList();
    }

    private Checksum toChecksum() {
        String token = ChecksumAlgorithm.lookup(algorithm)
            .map(ChecksumAlgorithm::token)
            .orElse(algorithm == null ? "" : algorithm.trim().toUpperCase(Locale.ROOT));
        return new Checksum(token, value);
    }
}
