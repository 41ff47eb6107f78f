package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;

/**
 * Licenses: the data license on the document subject, the concluded license otherwise.
 * Several configured licenses are combined into one {@code OR} expression.
 */
public class LicensesField extends AbstractFieldHandler {

    static final String DISJUNCTION = " OR ";

    public LicensesField() {
        super("licenses", FieldScope.DOCUMENT_OR_COMPONENT);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !request.licenses().isEmpty();
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        String expression = String.join(DISJUNCTION, request.licenses());
        if (subject.isDocument()) {
            subject.updateDocument(d -> d.withDataLicense(policy.scalar(d.dataLicense(), expression)));
        } else {
            subject.updateComponent(c -> c.withLicenseConcluded(policy.scalar(c.licenseConcluded(), expression)));
        }
        return FieldOutcome.APPLIED;
    }
}
