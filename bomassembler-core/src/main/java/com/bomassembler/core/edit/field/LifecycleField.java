package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;

/**
 * Lifecycle stages, written as the creation comment {@code "lifecycle: build,post-build"}.
 */
public class LifecycleField extends AbstractFieldHandler {

    static final String PREFIX = "lifecycle: ";

    public LifecycleField() {
        super("lifecycle-stages", FieldScope.DOCUMENT);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !request.lifecycles().isEmpty();
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        String comment = PREFIX + String.join(",", request.lifecycles());
        subject.updateCreationInfo(info -> info.withComment(policy.scalar(info.comment(), comment)));
        return FieldOutcome.APPLIED;
    }
}
