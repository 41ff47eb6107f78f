package com.bomassembler.core.merge;

import com.bomassembler.core.model.CreationInfo;
import com.bomassembler.core.model.Document;
import org.semver4j.Semver;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Picks the license-list version of a merged document.
 *
 * <ul>
 *   <li>No input declares one: {@link #BASELINE}</li>
 *   <li>All inputs agree: that version, verbatim</li>
 *   <li>Inputs disagree: the lowest version, compared as semantic versions</li>
 * </ul>
 */
public final class LicenseListVersions {

    /** Version used when no input declares one. */
    public static final String BASELINE = "3.19";

    private LicenseListVersions() {
        // Utility class
    }

    /**
     * Selects the license-list version for the merged document.
     *
     * @param inputs input documents
     * @return selected version string, as written by the input it came from
     * @throws LicenseListVersionException if versions differ and one cannot be parsed
     */
    public static String select(List<Document> inputs) {
        Set<String> distinct = inputs.stream()
            .map(Document::creationInfo)
            .filter(Objects::nonNull)
            .map(CreationInfo::licenseListVersion)
            .filter(v -> v != null && !v.isBlank())
            .map(String::trim)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        if (distinct.isEmpty()) {
            return BASELINE;
        }
        if (distinct.size() == 1) {
            return distinct.iterator().next();
        }

        // Insertion order makes equal versions ("3.19", "3.19.0") resolve to the first input
        Map<String, Semver> parsed = distinct.stream()
            .collect(Collectors.toMap(Function.identity(), LicenseListVersions::parse,
                (first, second) -> first, LinkedHashMap::new));

        return parsed.entrySet().stream()
            .min(Map.Entry.comparingByValue())
            .map(Map.Entry::getKey)
            .orElse(BASELINE);
    }

    private static Semver parse(String version) {
        Semver semver = Semver.coerce(version);
        if (semver == null) {
            throw new LicenseListVersionException("License list version is not a valid version: " + version);
        }
        return semver;
    }
}
