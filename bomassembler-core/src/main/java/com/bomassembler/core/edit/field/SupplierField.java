package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.model.Supplier;

/**
 * Component supplier, always recorded as an organization.
 */
public class SupplierField extends AbstractFieldHandler {

    public SupplierField() {
        super("supplier", FieldScope.COMPONENT);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return request.supplier() != null && !request.supplier().blank();
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        Supplier supplier = Supplier.organization(request.supplier().display());
        subject.updateComponent(c -> c.withSupplier(policy.scalar(c.supplier(), supplier)));
        return FieldOutcome.APPLIED;
    }
}
