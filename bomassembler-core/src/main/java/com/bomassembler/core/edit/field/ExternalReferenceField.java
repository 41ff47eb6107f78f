package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditSubject;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.model.ExternalReference;
import com.bomassembler.core.util.Strings;

import java.util.function.Function;

/**
 * One well-known kind of external reference (purl or cpe), keyed by reference type.
 *
 * <p>Under {@link EditPolicy#APPEND} an existing reference of the same kind is kept and a second
 * one is added; only {@link EditPolicy#OVERWRITE} guarantees a single reference of the kind.
 */
public class ExternalReferenceField extends AbstractFieldHandler {

    private final String referenceType;
    private final Function<EditRequest, String> configured;
    private final Function<String, ExternalReference> factory;

    public ExternalReferenceField(String name,
                                  String referenceType,
                                  Function<EditRequest, String> configured,
                                  Function<String, ExternalReference> factory) {
        super(name, FieldScope.COMPONENT);
        this.referenceType = referenceType;
        this.configured = configured;
        this.factory = factory;
    }

    public static ExternalReferenceField purl() {
        return new ExternalReferenceField("purl", ExternalReference.TYPE_PURL, EditRequest::purl,
            ExternalReference::purl);
    }

    public static ExternalReferenceField cpe() {
        return new ExternalReferenceField("cpe", ExternalReference.TYPE_CPE23, EditRequest::cpe,
            ExternalReference::cpe);
    }

    @Override
    protected boolean isConfigured(EditRequest request) {
        return !Strings.isEmpty(configured.apply(request));
    }

    @Override
    protected FieldOutcome update(EditSubject subject, EditPolicy policy, EditRequest request) {
        if (policy == EditPolicy.MISSING && subject.component().hasExternalReference(referenceType)) {
            log.debug("Keeping existing {} reference of {}", referenceType, subject.component().id());
            return FieldOutcome.APPLIED;
        }
        ExternalReference reference = factory.apply(configured.apply(request));
        subject.updateComponent(c -> c.withExternalReferences(
            policy.keyed(c.externalReferences(), reference, ref -> ref.hasType(referenceType))));
        return FieldOutcome.APPLIED;
    }
}
