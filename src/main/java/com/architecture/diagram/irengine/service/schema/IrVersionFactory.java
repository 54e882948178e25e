package com.architecture.diagram.irengine.service.schema;

import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Mints validated {@link IrVersion} documents and converts them to and from the wire format.
 *
 * Version numbers are a pure function of the parent passed in; serializing concurrent writers
 * is the caller's job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IrVersionFactory {

    static final String LEGACY_RELATION_TYPE = "relates_to";

    private final IrSchemaValidator schemaValidator;
    private final ObjectMapper objectMapper = IrJson.newMapper();

    /**
     * Builds version {@code parentVersion + 1} (or 1 for a root) around a private copy of {@code ir}.
     *
     * @throws SchemaValidationException if the resulting document is not schema-valid
     */
    public IrVersion makeVersion(String diagramId, IrDocument ir, Integer parentVersion) {
        int irVersion = parentVersion == null ? 1 : parentVersion + 1;
        IrVersion version = IrVersion.builder()
                .diagramId(diagramId)
                .irVersion(irVersion)
                .parentVersion(parentVersion)
                .ir(copy(ir))
                .build();
        schemaValidator.requireValid(version);
        log.debug("Minted version {} of diagram {} (parent {})", irVersion, diagramId, parentVersion);
        return version;
    }

    /**
     * Accepts a stored payload in either shape. An already-versioned document is validated and
     * returned as-is; a bare {@code {"diagram": ...}} document becomes version 1 with no parent.
     * Legacy {@code relations} lists are converted into full edges.
     */
    public IrVersion upgrade(JsonNode legacyPayload, String diagramId) {
        if (legacyPayload == null || !legacyPayload.isObject()) {
            throw new SchemaValidationException("", "legacy payload must be an object", null);
        }
        if (legacyPayload.has("ir_version")) {
            schemaValidator.requireValid(legacyPayload);
            return bind(legacyPayload);
        }
        if (!legacyPayload.path("diagram").isObject()) {
            throw new SchemaValidationException("/diagram", "legacy payload has no diagram object", null);
        }

        ObjectNode diagram = ((ObjectNode) legacyPayload.get("diagram")).deepCopy();
        String resolvedId = diagramId != null ? diagramId : diagram.path("id").asText(null);
        if (!diagram.has("id") && resolvedId != null) {
            diagram.put("id", resolvedId);
        }
        if (!diagram.has("edges")) {
            diagram.set("edges", convertRelations(diagram.path("relations")));
        }
        diagram.remove("relations");
        if (!diagram.has("blocks")) {
            diagram.putArray("blocks");
        }

        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.put("diagram_id", resolvedId);
        wrapped.put("ir_version", 1);
        wrapped.putNull("parent_version");
        wrapped.putObject("ir").set("diagram", diagram);

        schemaValidator.requireValid(wrapped);
        log.info("Upgraded legacy IR payload for diagram {} to version 1 ({} blocks, {} edges)",
                resolvedId, diagram.path("blocks").size(), diagram.path("edges").size());
        return bind(wrapped);
    }

    public IrVersion fromJson(String json) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("", "not valid JSON: " + e.getOriginalMessage(), e);
        }
        schemaValidator.requireValid(tree);
        return bind(tree);
    }

    public String toJson(IrVersion version) {
        try {
            return objectMapper.writeValueAsString(version);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("IR version could not be serialized", e);
        }
    }

    public JsonNode toTree(IrVersion version) {
        return objectMapper.valueToTree(version);
    }

    /**
     * Deep copy through the wire format, so callers can edit the result freely.
     */
    public IrDocument copy(IrDocument ir) {
        return objectMapper.convertValue(ir, IrDocument.class);
    }

    private IrVersion bind(JsonNode tree) {
        try {
            return objectMapper.treeToValue(tree, IrVersion.class);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("", "payload could not be bound: " + e.getOriginalMessage(), e);
        }
    }

    private ArrayNode convertRelations(JsonNode relations) {
        ArrayNode edges = objectMapper.createArrayNode();
        if (!relations.isArray()) {
            return edges;
        }
        for (int i = 0; i < relations.size(); i++) {
            JsonNode relation = relations.get(i);
            ObjectNode edge = edges.addObject();
            edge.put("edge_id", relation.path("id").asText("legacy_edge_" + (i + 1)));
            edge.put("from", relation.path("from").asText(""));
            edge.put("to", relation.path("to").asText(""));
            edge.put("relation_type", relation.path("type").asText(LEGACY_RELATION_TYPE));
            edge.put("direction", "unidirectional");
            edge.put("category", "data_flow");
            edge.put("mode", "sync");
            edge.put("label", relation.path("label").asText(""));
            edge.put("confidence", 1.0);
        }
        log.info("Converted {} legacy relations into edges", relations.size());
        return edges;
    }
}
