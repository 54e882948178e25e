package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.SvgImportResult;
import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.architecture.diagram.irengine.service.schema.IrSchemaValidator;
import com.architecture.diagram.irengine.service.schema.IrVersionFactory;
import com.architecture.diagram.irengine.service.svg.SvgDocument;
import com.architecture.diagram.irengine.service.svg.SvgDocumentParser;
import com.architecture.diagram.irengine.service.svg.SvgDocumentWriter;
import com.architecture.diagram.irengine.service.svg.SvgStructuralAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.diagram.irengine.IrFixtures.block;
import static com.architecture.diagram.irengine.IrFixtures.document;
import static com.architecture.diagram.irengine.IrFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SvgIrReaderTest {

    private final SvgIrReader reader = new SvgIrReader(
            new SvgStructuralAnalyzer(AnalysisOptions.DEFAULT), new IrVersionFactory(new IrSchemaValidator()));

    @Test
    void recoversBlocksAndEdges_fromRenderedMetadata() {
        Block api = block("api", "API", 40, 40);
        api.setZone("core");
        IrDocument ir = document("shop", List.of(api, block("db", "DB", 240, 40)), List.of(edge("e1", "api", "db")));
        ir.getDiagram().setZoneOrder(List.of("core"));
        ir.getDiagram().setLayout("left-right");

        SvgImportResult result = reader.read(new SvgIrRenderer().render(ir), "shop");

        assertThat(result.isFromMetadata()).isTrue();
        assertThat(result.getUnresolvedEdgeIds()).isEmpty();
        assertThat(result.getVersion().getIrVersion()).isEqualTo(1);
        assertThat(result.getVersion().getParentVersion()).isNull();
        Diagram diagram = result.getVersion().diagram();
        assertThat(diagram.getBlockIds()).containsExactly("api", "db");
        assertThat(diagram.findBlock("api").orElseThrow().getZone()).isEqualTo("core");
        assertThat(diagram.getEdges()).extracting(IrEdge::getEdgeId).containsExactly("e1");
        assertThat(diagram.getZoneOrder()).containsExactly("core");
        assertThat(diagram.getLayout()).isEqualTo("left-right");
    }

    @Test
    void dropsMetadataBlocksWithoutNodeGroups_andReportsTheirEdges() {
        IrDocument ir = document("shop",
                List.of(block("api", "API", 40, 40), block("db", "DB", 240, 40)),
                List.of(edge("e1", "api", "db")));
        SvgDocument rendered = SvgDocumentParser.parse(new SvgIrRenderer().render(ir));
        SvgDocument.Builder edited = rendered.toBuilder();
        edited.remove(rendered.findById("db").orElseThrow().getIndex());

        SvgImportResult result = reader.read(SvgDocumentWriter.write(edited.build()), "shop");

        assertThat(result.getVersion().diagram().getBlockIds()).containsExactly("api");
        assertThat(result.getVersion().diagram().getEdges()).isEmpty();
        assertThat(result.getUnresolvedEdgeIds()).containsExactly("e1");
    }

    @Test
    void readsPlainSvg_andReportsUnresolvedConnectors() {
        String svg = """
                <svg xmlns="http://www.w3.org/2000/svg" width="300" height="100">
                  <rect id="a" x="0" y="0" width="40" height="40"/>
                  <text x="5" y="20">Alpha</text>
                  <rect id="b" x="200" y="0" width="40" height="40"/>
                  <line id="connector" x1="40" y1="20" x2="200" y2="20"/>
                </svg>
                """;

        SvgImportResult result = reader.read(svg, "plain");

        assertThat(result.isFromMetadata()).isFalse();
        Diagram diagram = result.getVersion().diagram();
        assertThat(diagram.getBlockIds()).containsExactly("a", "b");
        assertThat(diagram.findBlock("a").orElseThrow().getText()).isEqualTo("Alpha");
        assertThat(diagram.findBlock("b").orElseThrow().getType()).isEqualTo("component");
        assertThat(diagram.getEdges()).isEmpty();
        assertThat(result.getUnresolvedEdgeIds()).containsExactly("connector");
    }

    @Test
    void rejectsMetadataThatIsNotJson() {
        String svg = """
                <svg xmlns="http://www.w3.org/2000/svg">
                  <metadata id="ir_metadata">{not json</metadata>
                  <rect id="a" x="0" y="0" width="40" height="40"/>
                </svg>
                """;

        assertThatThrownBy(() -> reader.read(svg, "broken"))
                .isInstanceOf(SchemaValidationException.class);
    }
}
