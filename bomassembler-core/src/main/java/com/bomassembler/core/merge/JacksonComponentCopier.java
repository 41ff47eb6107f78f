package com.bomassembler.core.merge;

import com.bomassembler.core.json.BomJson;
import com.bomassembler.core.model.Component;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Deep-copies components through a JSON tree round trip.
 */
public class JacksonComponentCopier implements ComponentCopier {

    private final ObjectMapper mapper;

    public JacksonComponentCopier() {
        this(BomJson.mapper());
    }

    public JacksonComponentCopier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Component copy(Component component) throws ComponentCopyException {
        try {
            JsonNode tree = mapper.valueToTree(component);
            return mapper.treeToValue(tree, Component.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ComponentCopyException("Cannot copy component " + component.id(), e);
        }
    }
}
