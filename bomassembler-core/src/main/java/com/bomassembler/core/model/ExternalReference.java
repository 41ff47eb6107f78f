package com.bomassembler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Typed external locator attached to a component.
 *
 * @param category reference category (e.g. {@code PACKAGE-MANAGER}, {@code SECURITY})
 * @param type reference type, the uniqueness key used by edits (e.g. {@code purl})
 * @param locator the locator itself
 * @param comment optional comment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"referenceCategory", "referenceType", "referenceLocator", "comment"})
public record ExternalReference(
    @JsonProperty("referenceCategory") String category,
    @JsonProperty("referenceType") String type,
    @JsonProperty("referenceLocator") String locator,
    @JsonProperty("comment") String comment
) {
    public static final String CATEGORY_PACKAGE_MANAGER = "PACKAGE-MANAGER";
    public static final String CATEGORY_SECURITY = "SECURITY";

    /** Package URL reference type. */
    public static final String TYPE_PURL = "purl";

    /** CPE 2.3 reference type. */
    public static final String TYPE_CPE23 = "cpe23Type";

    public static ExternalReference purl(String locator) {
        return new ExternalReference(CATEGORY_PACKAGE_MANAGER, TYPE_PURL, locator, null);
    }

    public static ExternalReference cpe(String locator) {
        return new ExternalReference(CATEGORY_SECURITY, TYPE_CPE23, locator, null);
    }

    /**
     * Exact, case-sensitive comparison of the reference type.
     *
     * @param referenceType type to compare with
     * @return true if this reference has exactly that type
     */
    public boolean hasType(String referenceType) {
        return referenceType.equals(type);
    }
}
