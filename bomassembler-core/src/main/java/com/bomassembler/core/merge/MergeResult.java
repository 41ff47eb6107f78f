package com.bomassembler.core.merge;

import com.bomassembler.core.model.Document;

/**
 * Output of a merge.
 *
 * @param document merged document
 * @param rootComponentId identifier of the synthesized root component
 * @param statistics merge counters
 */
public record MergeResult(Document document, String rootComponentId, MergeStatistics statistics) {
}
