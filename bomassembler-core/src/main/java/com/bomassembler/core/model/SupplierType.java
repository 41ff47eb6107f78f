package com.bomassembler.core.model;

/**
 * Kinds of component suppliers.
 */
public enum SupplierType {
    ORGANIZATION,
    PERSON,
    /** No claim is made about the supplier. */
    NOASSERTION
}
