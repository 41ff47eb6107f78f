package com.bomassembler.core.merge;

import com.bomassembler.core.model.Document;

import java.util.List;

/**
 * Combines several documents into one. Inputs are processed in list order and are never modified.
 */
public interface DocumentMerger {

    /**
     * Merges the inputs.
     *
     * @param inputs loaded documents, in the order they were given
     * @return merged document and statistics
     * @throws LicenseListVersionException if the inputs' license-list versions cannot be reconciled
     * @throws UnsupportedOperationException if the merge mode is not implemented
     */
    MergeResult merge(List<Document> inputs);
}
