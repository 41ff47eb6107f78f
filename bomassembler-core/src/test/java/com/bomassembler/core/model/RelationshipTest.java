package com.bomassembler.core.model;

import com.bomassembler.core.json.BomJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Relationship}.
 */
class RelationshipTest {

    private static Relationship read(String json) throws JsonProcessingException {
        return BomJson.mapper().readValue(json, Relationship.class);
    }

    @Test
    void read_knownKind_hasNoDeclaredToken() throws JsonProcessingException {
        Relationship rel = read("""
            {"spdxElementId": "SPDXRef-a", "relatedSpdxElement": "SPDXRef-b", "relationshipType": "DEPENDS_ON"}
            """);

        assertThat(rel.type()).isEqualTo(RelationshipType.DEPENDS_ON);
        assertThat(rel.declaredType()).isNull();
        assertThat(rel).isEqualTo(Relationship.of("SPDXRef-a", RelationshipType.DEPENDS_ON, "SPDXRef-b"));
    }

    @Test
    void rewrite_keepsDeclaredTokenAndExtras() throws JsonProcessingException {
        Relationship rel = read("""
            {"spdxElementId": "SPDXRef-a", "relatedSpdxElement": "SPDXRef-b",
             "relationshipType": "SOMETHING_NEW", "x-origin": "scanner"}
            """);

        Relationship rewritten = rel.rewrite("SPDXRef-a", "SPDXRef-Package-1");

        JsonNode encoded = BomJson.mapper().valueToTree(rewritten);
        assertThat(rewritten.type()).isEqualTo(RelationshipType.OTHER);
        assertThat(encoded.get("spdxElementId").asText()).isEqualTo("SPDXRef-Package-1");
        assertThat(encoded.get("relationshipType").asText()).isEqualTo("SOMETHING_NEW");
        assertThat(encoded.get("x-origin").asText()).isEqualTo("scanner");
        assertThat(encoded.has("type")).isFalse();
        assertThat(encoded.has("declaredType")).isFalse();
    }
}
