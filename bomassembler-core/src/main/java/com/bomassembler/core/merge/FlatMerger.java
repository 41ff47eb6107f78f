package com.bomassembler.core.merge;

import com.bomassembler.core.model.Document;

import java.util.List;

/**
 * Flat merge: all inputs collapsed into one namespace without a synthesized root.
 *
 * <p>Not implemented. It fails before touching the inputs or producing output.
 */
public class FlatMerger implements DocumentMerger {

    @Override
    public MergeResult merge(List<Document> inputs) {
        throw new UnsupportedOperationException("Flat merge is not implemented; use hierarchical merge");
    }
}
