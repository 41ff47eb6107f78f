package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;

/**
 * Applies one named field of an edit request to a subject.
 *
 * <p>Handlers are run in a fixed order by the
 * {@link com.bomassembler.core.edit.FieldReconciliationEngine}. A handler never throws for the
 * expected skip cases; it reports them as a {@link FieldOutcome} so the remaining fields still run.
 *
 * @see AbstractFieldHandler
 */
public interface FieldHandler {

    /**
     * Returns the field name used in reports and logs (e.g. {@code purl}).
     *
     * @return field name
     */
    String name();

    /**
     * Returns where this field may be applied.
     *
     * @return field scope
     */
    FieldScope scope();

    /**
     * Applies the field.
     *
     * @param subject subject under edit, updated in place
     * @param policy edit policy
     * @param request configured values
     * @return outcome of this field
     */
    FieldOutcome apply(EditSubject subject, EditPolicy policy, EditRequest request);
}
