package com.architecture.diagram.irengine.service.schema;

import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.dto.ir.SchemaViolation;
import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.diagram.irengine.IrFixtures.block;
import static com.architecture.diagram.irengine.IrFixtures.document;
import static com.architecture.diagram.irengine.IrFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IrSchemaValidatorTest {

    private final IrSchemaValidator validator = new IrSchemaValidator();
    private final ObjectMapper objectMapper = IrJson.newMapper();

    private IrVersion validVersion() {
        IrDocument doc = document("checkout",
                List.of(block("api", "API"), block("db", "Database")),
                List.of(edge("api__db__sync", "api", "db")));
        return IrVersion.builder().diagramId("checkout").irVersion(2).parentVersion(1).ir(doc).build();
    }

    @Test
    void acceptsWellFormedVersion() {
        assertThat(validator.validate(validVersion())).isEmpty();
    }

    @Test
    void rejectsVersionNotAboveParent() {
        ObjectNode payload = objectMapper.valueToTree(validVersion());
        payload.put("parent_version", 2);

        List<SchemaViolation> violations = validator.validate(payload);

        assertThat(violations).extracting(SchemaViolation::getPath).containsExactly("/ir_version");
    }

    @Test
    void collectsEveryEdgeViolation_withPointerPaths() {
        ObjectNode payload = objectMapper.valueToTree(validVersion());
        ObjectNode edge = (ObjectNode) payload.at("/ir/diagram/edges/0");
        edge.put("confidence", 1.5);
        edge.put("direction", "sideways");
        edge.remove("label");

        List<SchemaViolation> violations = validator.validate(payload);

        assertThat(violations).extracting(SchemaViolation::getPath).containsExactlyInAnyOrder(
                "/ir/diagram/edges/0/confidence",
                "/ir/diagram/edges/0/direction",
                "/ir/diagram/edges/0/label");
    }

    @Test
    void rejectsDuplicateBlockIds_andUnexpectedRootKeys() {
        ObjectNode payload = objectMapper.valueToTree(validVersion());
        payload.put("generated_at", "yesterday");
        ObjectNode second = (ObjectNode) payload.at("/ir/diagram/blocks/1");
        second.put("id", "api");

        List<SchemaViolation> violations = validator.validate(payload);

        assertThat(violations).extracting(SchemaViolation::getPath)
                .contains("/generated_at", "/ir/diagram/blocks/1/id");
    }

    @Test
    void rejectsNegativeBoundingBoxSize() {
        ObjectNode payload = objectMapper.valueToTree(validVersion());
        ((ObjectNode) payload.at("/ir/diagram/blocks/0/bbox")).put("w", -1);

        assertThatThrownBy(() -> validator.requireValid((JsonNode) payload))
                .isInstanceOf(SchemaValidationException.class)
                .satisfies(e -> assertThat(((SchemaValidationException) e).getViolations())
                        .extracting(SchemaViolation::getMessage)
                        .containsExactly("must be >= 0"));
    }

    @Test
    void rejectsNonObjectPayload() {
        assertThat(validator.validate(objectMapper.createArrayNode()))
                .extracting(SchemaViolation::getMessage)
                .containsExactly("payload must be an object");
    }
}
