package com.bomassembler.core.edit.field;

import com.bomassembler.core.config.HashSpec;
import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.model.Checksum;

import java.util.List;

/**
 * Component checksums. Configured entries with an empty value are dropped before the update.
 */
public class HashesField extends AbstractFieldHandler {

    public HashesField() {
        super("hashes", FieldScope.COMPONENT);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !request.hashes().isEmpty();
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        List<Checksum> checksums = HashSpec.toChecksums(request.hashes());
        subject.updateComponent(c -> c.withChecksums(policy.list(c.checksums(), checksums)));
        return FieldOutcome.APPLIED;
    }
}
