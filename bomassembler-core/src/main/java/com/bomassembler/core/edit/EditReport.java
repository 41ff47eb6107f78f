package com.bomassembler.core.edit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-field outcomes of one edit, in field table order.
 *
 * @param outcomes outcome by field name
 */
public record EditReport(Map<String, FieldOutcome> outcomes) {

    public EditReport {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    /**
     * Returns the outcome of a field.
     *
     * @param field field name, e.g. {@code purl}
     * @return outcome, null if the field is not in the table
     */
    public FieldOutcome outcome(String field) {
        return outcomes.get(field);
    }

    /**
     * Lists the fields that ended with the given outcome.
     *
     * @param outcome outcome to filter by
     * @return field names in table order
     */
    public List<String> fieldsWith(FieldOutcome outcome) {
        return outcomes.entrySet().stream()
            .filter(e -> e.getValue() == outcome)
            .map(Map.Entry::getKey)
            .toList();
    }
}
