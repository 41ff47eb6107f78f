package com.bomassembler.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for SPDX JSON documents.
 *
 * <p>Documents, packages, creation info and relationships keep the properties they do not model
 * and write them back, so a load and write cycle loses nothing. Output is pretty-printed.
 */
public final class BomJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.INDENT_OUTPUT, true);

    private BomJson() {
        // Utility class
    }

    /**
     * Returns the shared mapper. The mapper is thread-safe once configured and must not be
     * reconfigured by callers.
     *
     * @return object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Encodes a value as pretty-printed UTF-8 JSON.
     *
     * @param value value to encode
     * @return encoded bytes
     * @throws JsonProcessingException if the value cannot be serialized
     */
    public static byte[] encode(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(value);
    }
}
