package com.bomassembler.core.edit;

/**
 * Result of applying one field. Only {@link #APPLIED} means the field was processed; the other
 * outcomes skip the field without affecting the rest.
 */
public enum FieldOutcome {
    /** The field was evaluated under the policy (it may still have kept the old value). */
    APPLIED,

    /** No value was configured for the field. */
    NO_CONFIGURATION,

    /** The field does not apply to the resolved subject. */
    NOT_SUPPORTED,

    /** The configured value is outside the field's vocabulary. */
    INVALID_INPUT
}
