package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.StructuralEdge;
import com.architecture.diagram.irengine.dto.codec.StructuralGroup;
import com.architecture.diagram.irengine.dto.codec.StructuralIr;
import com.architecture.diagram.irengine.dto.codec.StructuralNode;
import com.architecture.diagram.irengine.dto.enrich.Layout;
import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.service.svg.SvgStructuralAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.diagram.irengine.IrFixtures.block;
import static com.architecture.diagram.irengine.IrFixtures.document;
import static com.architecture.diagram.irengine.IrFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;

class StructuralIrMapperTest {

    private final StructuralIrMapper mapper = new StructuralIrMapper();

    @Test
    void skipsHiddenBlocksAndTheirEdges_butReportsMissingEndpoints() {
        Block hidden = block("cache", "Cache");
        hidden.setHidden(true);
        IrDocument ir = document("shop",
                List.of(block("api", "API"), hidden, block("db", "DB")),
                List.of(edge("e1", "api", "cache"), edge("e2", "api", "db"), edge("e3", "api", "ghost")));

        StructuralIr structural = mapper.fromIr(ir);

        assertThat(structural.getNodes()).extracting(StructuralNode::getId).containsExactly("api", "db");
        assertThat(structural.getEdges()).extracting(StructuralEdge::getId).containsExactly("e2");
        assertThat(structural.getUnresolved()).singleElement().satisfies(e -> {
            assertThat(e.getId()).isEqualTo("e3");
            assertThat(e.getFrom()).isEqualTo("api");
            assertThat(e.getTo()).isNull();
        });
        assertThat(structural.getTitle()).isEqualTo("shop");
        assertThat(structural.getNodes()).allSatisfy(n -> assertThat(n.getKind()).isEqualTo("component"));
    }

    @Test
    void groupsBlocksByZone_inDeclaredZoneOrder() {
        Block api = block("api", "API");
        api.setZone("core");
        Block db = block("db", "DB");
        db.setZone("data");
        IrDocument ir = document("shop", List.of(api, db, block("free", "Free")), List.of());
        ir.getDiagram().setZoneOrder(List.of("data", "core", "empty"));
        ir.getDiagram().setLayout("left to right");

        StructuralIr structural = mapper.fromIr(ir);

        assertThat(structural.getGroups()).extracting(StructuralGroup::getId).containsExactly("data", "core");
        assertThat(structural.getGroups().get(1).getMembers()).containsExactly("api");
        assertThat(structural.getLayout()).isEqualTo(Layout.LEFT_RIGHT);
    }

    @Test
    void separatesUnresolvedSvgEdges_fromResolvedOnes() {
        String svg = """
                <svg xmlns="http://www.w3.org/2000/svg" width="300" height="100">
                  <rect id="a" x="0" y="0" width="40" height="40"/>
                  <rect id="b" x="200" y="0" width="40" height="40"/>
                  <line id="connector" x1="40" y1="20" x2="200" y2="20"/>
                  <line id="a_to_b" x1="40" y1="30" x2="200" y2="30"/>
                </svg>
                """;
        SvgStructuralAnalyzer analyzer = new SvgStructuralAnalyzer(AnalysisOptions.DEFAULT);

        StructuralIr structural = mapper.fromGraph(analyzer.analyze(svg, "loose"));

        assertThat(structural.getNodes()).extracting(StructuralNode::getId).containsExactly("a", "b");
        assertThat(structural.getEdges()).singleElement().satisfies(e -> {
            assertThat(e.getFrom()).isEqualTo("a");
            assertThat(e.getTo()).isEqualTo("b");
        });
        assertThat(structural.getUnresolved()).extracting(StructuralEdge::getId).containsExactly("connector");
    }
}
