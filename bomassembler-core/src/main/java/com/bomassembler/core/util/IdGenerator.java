package com.bomassembler.core.util;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Generates globally unique element identifiers and namespace suffixes.
 *
 * <p>Identifiers take the form {@code SPDXRef-<kind>-<uuid>}. The UUID source is injectable so
 * tests can produce predictable identifiers.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * IdGenerator ids = IdGenerator.random();
 * ids.elementId("RootPackage");  // SPDXRef-RootPackage-1b4e28ba-2fa1-11d2-883f-0016d3cca427
 * }</pre>
 */
public class IdGenerator {

    /** Prefix every SPDX element identifier carries. */
    public static final String ELEMENT_PREFIX = "SPDXRef-";

    private final Supplier<UUID> uuids;

    public IdGenerator(Supplier<UUID> uuids) {
        this.uuids = Objects.requireNonNull(uuids, "uuids must not be null");
    }

    /**
     * Creates a generator backed by random (type 4) UUIDs.
     *
     * @return random generator
     */
    public static IdGenerator random() {
        return new IdGenerator(UUID::randomUUID);
    }

    /**
     * Generates a new element identifier.
     *
     * @param kind identifier kind, e.g. {@code Package}
     * @return identifier such as {@code SPDXRef-Package-<uuid>}
     * @throws IllegalArgumentException if kind is null or blank
     */
    public String elementId(String kind) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Kind must not be null or blank");
        }
        return ELEMENT_PREFIX + kind + "-" + uuids.get();
    }

    /**
     * Generates a fresh UUID string.
     *
     * @return UUID string
     */
    public String uuid() {
        return uuids.get().toString();
    }
}
