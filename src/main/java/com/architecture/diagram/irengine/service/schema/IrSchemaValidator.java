package com.architecture.diagram.irengine.service.schema;

import com.architecture.diagram.irengine.dto.ir.EdgeCategory;
import com.architecture.diagram.irengine.dto.ir.EdgeDirection;
import com.architecture.diagram.irengine.dto.ir.EdgeMode;
import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.dto.ir.SchemaViolation;
import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Structural validation of versioned IR payloads, equivalent to the canonical JSON schema.
 * Collects every violation instead of stopping at the first one.
 */
@Service
@Slf4j
public class IrSchemaValidator {

    private static final Set<String> ROOT_KEYS = Set.of("diagram_id", "ir_version", "parent_version", "ir");
    private static final List<String> BBOX_KEYS = List.of("x", "y", "w", "h");

    private final ObjectMapper objectMapper = IrJson.newMapper();

    public List<SchemaViolation> validate(IrVersion version) {
        return validate(objectMapper.valueToTree(version));
    }

    public List<SchemaViolation> validate(JsonNode payload) {
        List<SchemaViolation> violations = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            violations.add(new SchemaViolation("", "payload must be an object"));
            return violations;
        }

        Iterator<String> names = payload.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!ROOT_KEYS.contains(name)) {
                violations.add(new SchemaViolation("/" + name, "unexpected property"));
            }
        }

        requireText(payload, "diagram_id", "", violations);
        Integer irVersion = requirePositiveInt(payload, "ir_version", "", violations);

        if (!payload.has("parent_version")) {
            violations.add(new SchemaViolation("/parent_version", "is required"));
        } else if (!payload.get("parent_version").isNull()) {
            Integer parent = requirePositiveInt(payload, "parent_version", "", violations);
            if (parent != null && irVersion != null && irVersion <= parent) {
                violations.add(new SchemaViolation("/ir_version", "must be greater than parent_version " + parent));
            }
        }

        JsonNode ir = requireObject(payload, "ir", "", violations);
        if (ir != null) {
            JsonNode diagram = requireObject(ir, "diagram", "/ir", violations);
            if (diagram != null) {
                validateDiagram(diagram, "/ir/diagram", violations);
            }
        }
        return violations;
    }

    /**
     * @throws SchemaValidationException listing every violation, when the payload is invalid
     */
    public void requireValid(JsonNode payload) {
        List<SchemaViolation> violations = validate(payload);
        if (!violations.isEmpty()) {
            log.error("IR payload rejected with {} schema violations", violations.size());
            throw new SchemaValidationException(violations);
        }
    }

    public void requireValid(IrVersion version) {
        requireValid((JsonNode) objectMapper.valueToTree(version));
    }

    // ========================= DIAGRAM =========================

    private void validateDiagram(JsonNode diagram, String path, List<SchemaViolation> out) {
        requireText(diagram, "id", path, out);
        requireText(diagram, "type", path, out);
        optionalType(diagram, "layout", path, JsonNode::isTextual, "must be a string", out);
        optionalType(diagram, "zone_order", path, JsonNode::isArray, "must be an array", out);
        optionalType(diagram, "global_intent", path, JsonNode::isObject, "must be an object", out);

        JsonNode blocks = requireArray(diagram, "blocks", path, out);
        if (blocks != null) {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < blocks.size(); i++) {
                validateBlock(blocks.get(i), path + "/blocks/" + i, seen, out);
            }
        }
        JsonNode edges = requireArray(diagram, "edges", path, out);
        if (edges != null) {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < edges.size(); i++) {
                validateEdge(edges.get(i), path + "/edges/" + i, seen, out);
            }
        }
    }

    private void validateBlock(JsonNode block, String path, Set<String> seenIds, List<SchemaViolation> out) {
        if (!block.isObject()) {
            out.add(new SchemaViolation(path, "must be an object"));
            return;
        }
        String id = requireText(block, "id", path, out);
        if (id != null && !seenIds.add(id)) {
            out.add(new SchemaViolation(path + "/id", "duplicate block id '" + id + "'"));
        }
        requireString(block, "type", path, out);
        requireString(block, "text", path, out);

        JsonNode bbox = requireObject(block, "bbox", path, out);
        if (bbox != null) {
            String bboxPath = path + "/bbox";
            for (String key : BBOX_KEYS) {
                JsonNode value = bbox.get(key);
                if (value == null) {
                    out.add(new SchemaViolation(bboxPath + "/" + key, "is required"));
                } else if (!value.isNumber()) {
                    out.add(new SchemaViolation(bboxPath + "/" + key, "must be a number"));
                } else if ((key.equals("w") || key.equals("h")) && value.asDouble() < 0) {
                    out.add(new SchemaViolation(bboxPath + "/" + key, "must be >= 0"));
                }
            }
            bbox.fieldNames().forEachRemaining(name -> {
                if (!BBOX_KEYS.contains(name)) {
                    out.add(new SchemaViolation(bboxPath + "/" + name, "unexpected property"));
                }
            });
        }

        optionalType(block, "style", path, JsonNode::isObject, "must be an object", out);
        optionalType(block, "annotations", path, JsonNode::isObject, "must be an object", out);
        optionalType(block, "hidden", path, JsonNode::isBoolean, "must be a boolean", out);
        optionalType(block, "zone", path, JsonNode::isTextual, "must be a string", out);
        if (block.has("version")) {
            requirePositiveInt(block, "version", path, out);
        }
    }

    private void validateEdge(JsonNode edge, String path, Set<String> seenIds, List<SchemaViolation> out) {
        if (!edge.isObject()) {
            out.add(new SchemaViolation(path, "must be an object"));
            return;
        }
        String id = requireText(edge, "edge_id", path, out);
        if (id != null && !seenIds.add(id)) {
            out.add(new SchemaViolation(path + "/edge_id", "duplicate edge id '" + id + "'"));
        }
        requireText(edge, "from", path, out);
        requireText(edge, "to", path, out);
        requireString(edge, "relation_type", path, out);
        requireString(edge, "label", path, out);
        requireEnum(edge, "direction", path, EdgeDirection.fromString(edge.path("direction").asText(null)) != null,
                EdgeDirection.wireValues(), out);
        requireEnum(edge, "category", path, EdgeCategory.fromString(edge.path("category").asText(null)) != null,
                EdgeCategory.wireValues(), out);
        requireEnum(edge, "mode", path, EdgeMode.fromString(edge.path("mode").asText(null)) != null,
                EdgeMode.wireValues(), out);

        JsonNode confidence = edge.get("confidence");
        if (confidence == null) {
            out.add(new SchemaViolation(path + "/confidence", "is required"));
        } else if (!confidence.isNumber()) {
            out.add(new SchemaViolation(path + "/confidence", "must be a number"));
        } else if (confidence.asDouble() < 0.0 || confidence.asDouble() > 1.0) {
            out.add(new SchemaViolation(path + "/confidence", "must be within [0, 1]"));
        }
        optionalType(edge, "inferred", path, JsonNode::isBoolean, "must be a boolean", out);
    }

    // ========================= HELPERS =========================

    private String requireString(JsonNode node, String field, String path, List<SchemaViolation> out) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            out.add(new SchemaViolation(path + "/" + field, "is required"));
            return null;
        }
        if (!value.isTextual()) {
            out.add(new SchemaViolation(path + "/" + field, "must be a string"));
            return null;
        }
        return value.asText();
    }

    private String requireText(JsonNode node, String field, String path, List<SchemaViolation> out) {
        String value = requireString(node, field, path, out);
        if (value != null && value.isBlank()) {
            out.add(new SchemaViolation(path + "/" + field, "must not be blank"));
            return null;
        }
        return value;
    }

    private Integer requirePositiveInt(JsonNode node, String field, String path, List<SchemaViolation> out) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            out.add(new SchemaViolation(path + "/" + field, "is required"));
            return null;
        }
        if (!value.isIntegralNumber()) {
            out.add(new SchemaViolation(path + "/" + field, "must be an integer"));
            return null;
        }
        if (value.asInt() < 1) {
            out.add(new SchemaViolation(path + "/" + field, "must be >= 1"));
            return null;
        }
        return value.asInt();
    }

    private JsonNode requireObject(JsonNode node, String field, String path, List<SchemaViolation> out) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            out.add(new SchemaViolation(path + "/" + field, "is required"));
            return null;
        }
        if (!value.isObject()) {
            out.add(new SchemaViolation(path + "/" + field, "must be an object"));
            return null;
        }
        return value;
    }

    private JsonNode requireArray(JsonNode node, String field, String path, List<SchemaViolation> out) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            out.add(new SchemaViolation(path + "/" + field, "is required"));
            return null;
        }
        if (!value.isArray()) {
            out.add(new SchemaViolation(path + "/" + field, "must be an array"));
            return null;
        }
        return value;
    }

    private void requireEnum(JsonNode node, String field, String path, boolean known, List<String> allowed,
                             List<SchemaViolation> out) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            out.add(new SchemaViolation(path + "/" + field, "is required"));
        } else if (!value.isTextual() || !known) {
            out.add(new SchemaViolation(path + "/" + field, "must be one of " + allowed));
        }
    }

    private void optionalType(JsonNode node, String field, String path,
                              Predicate<JsonNode> check, String message,
                              List<SchemaViolation> out) {
        JsonNode value = node.get(field);
        if (value != null && !value.isNull() && !check.test(value)) {
            out.add(new SchemaViolation(path + "/" + field, message));
        }
    }
}
