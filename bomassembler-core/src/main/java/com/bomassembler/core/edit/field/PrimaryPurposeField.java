package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.model.PrimaryPurpose;
import com.bomassembler.core.util.Strings;

import java.util.Arrays;
import java.util.Optional;

/**
 * Component primary purpose, validated against {@link PrimaryPurpose}.
 */
public class PrimaryPurposeField extends AbstractFieldHandler {

    public PrimaryPurposeField() {
        super("primary-purpose", FieldScope.COMPONENT);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !Strings.isEmpty(request.primaryPurpose());
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        Optional<PrimaryPurpose> purpose = PrimaryPurpose.lookup(request.primaryPurpose());
        if (purpose.isEmpty()) {
            log.warn("Unknown primary purpose '{}'; expected one of {}",
                request.primaryPurpose(), Arrays.toString(PrimaryPurpose.values()));
            return FieldOutcome.INVALID_INPUT;
        }
        subject.updateComponent(c -> c.withPrimaryPurpose(policy.scalar(c.primaryPurpose(), purpose.get())));
        return FieldOutcome.APPLIED;
    }
}
