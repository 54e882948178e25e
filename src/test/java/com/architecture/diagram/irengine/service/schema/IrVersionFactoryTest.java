package com.architecture.diagram.irengine.service.schema;

import com.architecture.diagram.irengine.dto.ir.EdgeCategory;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.diagram.irengine.IrFixtures.block;
import static com.architecture.diagram.irengine.IrFixtures.document;
import static com.architecture.diagram.irengine.IrFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IrVersionFactoryTest {

    private static final String LEGACY = """
            {
              "diagram": {
                "id": "legacy",
                "type": "architecture",
                "blocks": [
                  {"id": "a", "type": "service", "text": "A", "bbox": {"x": 0, "y": 0, "w": 10, "h": 10}},
                  {"id": "b", "type": "service", "text": "B", "bbox": {"x": 20, "y": 0, "w": 10, "h": 10}}
                ],
                "relations": [
                  {"from": "a", "to": "b", "label": "calls"}
                ]
              }
            }
            """;

    private final IrVersionFactory factory = new IrVersionFactory(new IrSchemaValidator());
    private final ObjectMapper objectMapper = IrJson.newMapper();

    @Test
    void mintsRootVersion_andChildVersionFromParent() {
        IrDocument doc = document("d1", List.of(block("a", "A")), List.of());

        IrVersion root = factory.makeVersion("d1", doc, null);
        IrVersion child = factory.makeVersion("d1", doc, 3);

        assertThat(root.getIrVersion()).isEqualTo(1);
        assertThat(root.root()).isTrue();
        assertThat(child.getIrVersion()).isEqualTo(4);
        assertThat(child.getParentVersion()).isEqualTo(3);
    }

    @Test
    void copiesInput_soLaterEditsDoNotLeakIntoVersion() {
        IrDocument doc = document("d1", List.of(block("a", "A")), List.of());
        IrVersion version = factory.makeVersion("d1", doc, null);

        doc.getDiagram().getBlocks().get(0).setText("changed");

        assertThat(version.diagram().getBlocks().get(0).getText()).isEqualTo("A");
    }

    @Test
    void refusesToMintSchemaInvalidDocument() {
        IrEdge bad = edge("a__b__sync", "a", "b");
        bad.setConfidence(2.0);
        IrDocument doc = document("d1", List.of(block("a", "A"), block("b", "B")), List.of(bad));

        assertThatThrownBy(() -> factory.makeVersion("d1", doc, null))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("/ir/diagram/edges/0/confidence");
    }

    @Test
    void upgradesLegacyRelations_intoVersionOneEdges() throws Exception {
        IrVersion version = factory.upgrade(objectMapper.readTree(LEGACY), null);

        assertThat(version.getDiagramId()).isEqualTo("legacy");
        assertThat(version.getIrVersion()).isEqualTo(1);
        assertThat(version.getParentVersion()).isNull();
        assertThat(version.diagram().getEdges()).singleElement().satisfies(e -> {
            assertThat(e.getEdgeId()).isEqualTo("legacy_edge_1");
            assertThat(e.getFrom()).isEqualTo("a");
            assertThat(e.getTo()).isEqualTo("b");
            assertThat(e.getRelationType()).isEqualTo("relates_to");
            assertThat(e.getCategory()).isEqualTo(EdgeCategory.DATA_FLOW);
            assertThat(e.getLabel()).isEqualTo("calls");
        });
        assertThat(factory.toTree(version).at("/ir/diagram").has("relations")).isFalse();
    }

    @Test
    void passesVersionedPayloadThrough_whenAlreadyUpgraded() {
        IrVersion original = factory.makeVersion("d1",
                document("d1", List.of(block("a", "A")), List.of()), 1);

        IrVersion upgraded = factory.upgrade(factory.toTree(original), "ignored");

        assertThat(upgraded.getIrVersion()).isEqualTo(2);
        assertThat(upgraded.getDiagramId()).isEqualTo("d1");
        assertThat(factory.toJson(upgraded)).isEqualTo(factory.toJson(original));
    }

    @Test
    void rejectsLegacyPayloadWithoutDiagram() throws Exception {
        assertThatThrownBy(() -> factory.upgrade(objectMapper.readTree("{\"blocks\": []}"), "x"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("/diagram");
    }

    @Test
    void rejectsTextThatIsNotJson() {
        assertThatThrownBy(() -> factory.fromJson("{not json"))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("not valid JSON");
    }
}
