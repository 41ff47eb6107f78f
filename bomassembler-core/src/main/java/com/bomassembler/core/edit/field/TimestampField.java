package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.util.Timestamps;

import java.time.Clock;
import java.util.Objects;

/**
 * Creation timestamp, set to the current UTC time on every edit regardless of policy.
 */
public class TimestampField extends AbstractFieldHandler {

    private final Clock clock;

    public TimestampField(Clock clock) {
        super("timestamp", FieldScope.ALWAYS);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return true;
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        String now = Timestamps.utcNow(clock);
        subject.updateCreationInfo(info -> info.withCreated(now));
        return FieldOutcome.APPLIED;
    }
}
