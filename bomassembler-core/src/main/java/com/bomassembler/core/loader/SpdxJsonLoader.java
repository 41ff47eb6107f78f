package com.bomassembler.core.loader;

import com.bomassembler.core.json.BomJson;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.model.RelationshipType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads SPDX 2.3 JSON documents.
 *
 * <p>The legacy top-level {@code documentDescribes} array is folded into DESCRIBES relationships
 * (document to element) so the primary component resolves the same way for both encodings.
 */
public class SpdxJsonLoader implements DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(SpdxJsonLoader.class);

    private final ObjectMapper mapper;

    public SpdxJsonLoader() {
        this(BomJson.mapper());
    }

    public SpdxJsonLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Document load(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new BomLoadException("Document not found or not readable: " + path);
        }

        try {
            JsonNode tree = mapper.readTree(path.toFile());
            if (tree == null || !tree.isObject()) {
                throw new BomLoadException("Document is not a JSON object: " + path);
            }
            ObjectNode root = (ObjectNode) tree;
            foldDocumentDescribes(root);

            Document document = mapper.treeToValue(root, Document.class);
            log.debug("Loaded {} from {}: components={}, files={}, relationships={}",
                document.name(), path, document.components().size(), document.files().size(),
                document.relationships().size());
            return document;
        } catch (IOException | IllegalArgumentException e) {
            throw new BomLoadException("Failed to parse document " + path + ": " + e.getMessage(), e);
        }
    }

    private void foldDocumentDescribes(ObjectNode root) {
        JsonNode describes = root.get("documentDescribes");
        if (describes == null || !describes.isArray() || describes.isEmpty()) {
            return;
        }

        String documentId = root.path("SPDXID").asText(Document.DOCUMENT_ID);
        ArrayNode relationships = root.has("relationships") && root.get("relationships").isArray()
            ? (ArrayNode) root.get("relationships")
            : root.putArray("relationships");

        for (JsonNode element : describes) {
            String target = element.asText();
            if (!hasDescribes(relationships, documentId, target)) {
                ObjectNode rel = relationships.addObject();
                rel.put("spdxElementId", documentId);
                rel.put("relatedSpdxElement", target);
                rel.put("relationshipType", RelationshipType.DESCRIBES.name());
            }
        }
        root.remove("documentDescribes");
    }

    private static boolean hasDescribes(ArrayNode relationships, String documentId, String target) {
        for (JsonNode rel : relationships) {
            if (RelationshipType.DESCRIBES.name().equals(rel.path("relationshipType").asText())
                && documentId.equals(rel.path("spdxElementId").asText())
                && target.equals(rel.path("relatedSpdxElement").asText())) {
                return true;
            }
        }
        return false;
    }
}
