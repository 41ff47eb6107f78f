package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.util.Strings;

/**
 * Description: the document comment on the document subject, the component description otherwise.
 */
public class DescriptionField extends AbstractFieldHandler {

    public DescriptionField() {
        super("description", FieldScope.DOCUMENT_OR_COMPONENT);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !Strings.isEmpty(request.description());
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        String value = request.description();
        if (subject.isDocument()) {
            subject.updateDocument(d -> d.withComment(policy.scalar(d.comment(), value)));
        } else {
            subject.updateComponent(c -> c.withDescription(policy.scalar(c.description(), value)));
        }
        return FieldOutcome.APPLIED;
    }
}
