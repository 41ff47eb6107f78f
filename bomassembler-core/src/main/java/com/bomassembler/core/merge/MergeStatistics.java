package com.bomassembler.core.merge;

/**
 * Counters collected while merging.
 *
 * <p>{@code componentsOut} always equals {@code 1 + componentsIn - cloneFailures}: the synthesized
 * root plus every input component that could be copied.
 *
 * @param inputs number of input documents
 * @param componentsIn components across all inputs
 * @param componentsOut components in the output, root included
 * @param cloneFailures components skipped because they could not be copied
 * @param describedComponents input components re-identified under the root
 * @param relationships relationships in the output
 * @param files file records in the output
 * @param otherLicenses other-license records in the output
 * @param externalDocumentRefs external document references in the output
 */
public record MergeStatistics(
    int inputs,
    int componentsIn,
    int componentsOut,
    int cloneFailures,
    int describedComponents,
    int relationships,
    int files,
    int otherLicenses,
    int externalDocumentRefs
) {
}
