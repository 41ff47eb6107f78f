package com.bomassembler.core.edit;

import java.util.Objects;

/**
 * Everything one edit run needs: where to edit, under which policy, and what.
 *
 * @param search subject search
 * @param policy edit policy
 * @param request configured field values
 */
public record EditSettings(SearchSpec search, EditPolicy policy, EditRequest request) {

    public EditSettings {
        Objects.requireNonNull(search, "search must not be null");
        if (policy == null) {
            policy = EditPolicy.OVERWRITE;
        }
        if (request == null) {
            request = EditRequest.builder().build();
        }
    }
}
