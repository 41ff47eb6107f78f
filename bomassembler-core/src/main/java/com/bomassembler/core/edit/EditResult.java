package com.bomassembler.core.edit;

import com.bomassembler.core.model.Document;

/**
 * Edited document together with the per-field report.
 *
 * @param document the document after all field updates
 * @param report field outcomes
 */
public record EditResult(Document document, EditReport report) {
}
