package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class for field handlers providing the common gate:
 * <ol>
 *   <li>{@link FieldOutcome#NO_CONFIGURATION} when the request has no value for the field</li>
 *   <li>{@link FieldOutcome#NOT_SUPPORTED} when the subject is outside the field's scope</li>
 *   <li>otherwise {@link #update(EditSubject, EditPolicy, EditRequest)}</li>
 * </ol>
 */
public abstract class AbstractFieldHandler implements FieldHandler {

    /**
     * Logger instance for this handler.
     * Automatically initialized with the concrete handler class name.
     */
    protected final Logger log;

    private final String name;
    private final FieldScope scope;

    protected AbstractFieldHandler(String name, FieldScope scope) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final FieldScope scope() {
        return scope;
    }

    @Override
    public final FieldOutcome apply(EditSubject subject, EditPolicy policy, EditRequest request) {
        if (!isConfigured(request)) {
            return FieldOutcome.NO_CONFIGURATION;
        }
        if (!scope.supports(subject)) {
            return FieldOutcome.NOT_SUPPORTED;
        }
        return update(subject, policy, request);
    }

    /**
     * Checks whether the request carries a value for this field.
     *
     * @param request configured values
     * @return true if the field should be processed
     */
    protected abstract boolean isConfigured(EditRequest request);

    /**
     * Applies the field to a subject that passed the gate.
     *
     * @param subject subject under edit
     * @param policy edit policy
     * @param request configured values
     * @return outcome, normally {@link FieldOutcome#APPLIED}
     */
    protected abstract FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request);
}
