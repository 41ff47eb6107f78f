package com.bomassembler.core.edit.field;

import com.bomassembler.core.config.Contact;
import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.model.Creator;

import java.util.List;

/**
 * Document authors, recorded as person creators. Appending does not deduplicate.
 */
public class AuthorsField extends AbstractFieldHandler {

    public AuthorsField() {
        super("authors", FieldScope.DOCUMENT);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !request.authors().isEmpty();
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        List<Creator> authors = request.authors().stream()
            .map(Contact::display)
            .map(Creator::person)
            .toList();
        subject.updateCreationInfo(info -> info.withCreators(policy.list(info.creators(), authors)));
        return FieldOutcome.APPLIED;
    }
}
