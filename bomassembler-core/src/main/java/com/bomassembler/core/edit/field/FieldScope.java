package com.bomassembler.core.edit.field;

import com.bomassembler.core.edit.EditSubject;

/**
 * Subjects a field may be applied to.
 */
public enum FieldScope {
    /** Only the document subject. */
    DOCUMENT,

    /** Only a resolved component. */
    COMPONENT,

    /** The document subject or a resolved component, with a different target for each. */
    DOCUMENT_OR_COMPONENT,

    /** Runs on every edit and always writes to the document. */
    ALWAYS;

    /**
     * Checks whether a subject is in scope.
     *
     * @param subject subject under edit
     * @return true if the field may be applied
     */
    public boolean supports(EditSubject subject) {
        return switch (this) {
            case DOCUMENT -> subject.isDocument();
            case COMPONENT -> !subject.isDocument() && subject.hasComponent();
            case DOCUMENT_OR_COMPONENT -> subject.isDocument() || subject.hasComponent();
            case ALWAYS -> true;
        };
    }
}
