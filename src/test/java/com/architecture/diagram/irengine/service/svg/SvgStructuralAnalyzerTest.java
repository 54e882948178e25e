package com.architecture.diagram.irengine.service.svg;

import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.dto.svg.EndpointResolution;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.SvgEdge;
import com.architecture.diagram.irengine.dto.svg.SvgGroup;
import com.architecture.diagram.irengine.dto.svg.SvgNode;
import com.architecture.diagram.irengine.exception.SvgParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SvgStructuralAnalyzerTest {

    private static final String ZONED_SVG = """
            <svg xmlns="http://www.w3.org/2000/svg" width="400" height="200">
              <g id="zone_core" data-kind="boundary">
                <rect x="0" y="0" width="400" height="200"/>
                <text x="5" y="15">Core</text>
              </g>
              <g id="api" data-kind="node" data-zone="core">
                <rect id="api_rect" x="20" y="40" width="100" height="40"/>
                <text>API</text>
              </g>
              <g id="db" data-kind="node">
                <rect x="220" y="40" width="100" height="40"/>
                <text>Database</text>
              </g>
              <g id="api_db_group" data-kind="edge" data-source="api" data-target="db">
                <line id="api_db" x1="120" y1="60" x2="220" y2="60"/>
                <text>reads</text>
              </g>
            </svg>
            """;

    private static final String STANDALONE_SVG = """
            <svg xmlns="http://www.w3.org/2000/svg" width="300" height="100">
              <rect id="a" x="0" y="0" width="40" height="40"/>
              <rect id="b" x="200" y="0" width="40" height="40"/>
              <line id="connector" x1="40" y1="20" x2="200" y2="20"/>
            </svg>
            """;

    private final SvgStructuralAnalyzer analyzer = new SvgStructuralAnalyzer(AnalysisOptions.DEFAULT);

    @Test
    void extractsNodesEdgesAndBoundaries_fromDataKindGroups() {
        StructuralGraph graph = analyzer.analyze(ZONED_SVG, "zoned");

        assertThat(graph.getNodeIds()).containsExactly("api", "db");
        assertThat(graph.getEdgeIds()).containsExactly("api_db");
        assertThat(graph.getGroupIds()).containsExactly("zone_core");
        assertThat(graph.getWidth()).isEqualTo(400);
        assertThat(graph.getViewbox()).isEqualTo("0 0 400 200");
        assertThat(graph.getDiagramType()).isEqualTo("architecture");

        SvgNode api = (SvgNode) graph.find("api").orElseThrow();
        assertThat(api.getLabel()).isEqualTo("API");
        assertThat(api.getZone()).isEqualTo("core");
        assertThat(api.getAnimatableSelector()).isEqualTo("#api_rect");
        assertThat(api.getParentId()).isEqualTo("zone_core");

        SvgNode db = (SvgNode) graph.find("db").orElseThrow();
        assertThat(db.getAnimatableSelector()).isEqualTo("#db rect");
        assertThat(db.getCenter().getX()).isEqualTo(270);
    }

    @Test
    void resolvesEdgeEndpoints_fromExplicitAttributes() {
        StructuralGraph graph = analyzer.analyze(ZONED_SVG, "zoned");

        SvgEdge edge = graph.getEdges().get(0);
        assertThat(edge.getGroupId()).isEqualTo("api_db_group");
        assertThat(edge.getSourceId()).isEqualTo("api");
        assertThat(edge.getTargetId()).isEqualTo("db");
        assertThat(edge.getLabel()).isEqualTo("reads");
        assertThat(edge.getEndpointResolution()).isEqualTo(EndpointResolution.EXPLICIT_ATTRIBUTE);
        assertThat(edge.getEndpointConfidence()).isEqualTo(1.0);

        SvgGroup zone = graph.getGroups().get(0);
        assertThat(zone.getLabel()).isEqualTo("Core");
        assertThat(zone.getMemberIds()).containsExactly("api", "db");
    }

    @Test
    void resolvesPlantUmlLinks_fromEntityIdsEmbeddedInLinkId() {
        String svg = """
                <svg xmlns="http://www.w3.org/2000/svg">
                  <g class="entity" id="ent0001" data-entity="Alice"><rect x="0" y="0" width="50" height="20"/></g>
                  <g class="entity" id="ent0002"><ellipse cx="200" cy="10" rx="20" ry="10"/><text>Bob</text></g>
                  <g class="link" id="link_ent0001_ent0002"><path d="M50 10 L180 10"/></g>
                </svg>
                """;

        StructuralGraph graph = analyzer.analyze(svg, "plantuml");

        assertThat(graph.getNodes()).extracting(SvgNode::getLabel).containsExactly("Alice", "Bob");
        SvgEdge link = graph.getEdges().get(0);
        assertThat(link.getId()).isEqualTo("link_ent0001_ent0002");
        assertThat(link.getSourceId()).isEqualTo("ent0001");
        assertThat(link.getTargetId()).isEqualTo("ent0002");
        assertThat(link.getEndpointResolution()).isEqualTo(EndpointResolution.ID_SUBSTRING);
        assertThat(link.getAnimatableSelector()).isEqualTo("#link_ent0001_ent0002 path");
    }

    @Test
    void keepsUnresolvedEdge_withNullEndpoints_whenGeometricFallbackIsOff() {
        StructuralGraph graph = analyzer.analyze(STANDALONE_SVG, "standalone");

        assertThat(graph.getNodeIds()).containsExactly("a", "b");
        SvgEdge connector = graph.getEdges().get(0);
        assertThat(connector.getSourceId()).isNull();
        assertThat(connector.getTargetId()).isNull();
        assertThat(connector.isFullyResolved()).isFalse();
        assertThat(connector.getEndpointResolution()).isEqualTo(EndpointResolution.UNRESOLVED);
    }

    @Test
    void resolvesEndpointsToNearestNodes_whenGeometricFallbackIsOn() {
        AnalysisOptions options = AnalysisOptions.builder().geometricEndpointFallback(true).build();

        StructuralGraph graph = analyzer.analyze(STANDALONE_SVG, "standalone", options);

        SvgEdge connector = graph.getEdges().get(0);
        assertThat(connector.getSourceId()).isEqualTo("a");
        assertThat(connector.getTargetId()).isEqualTo("b");
        assertThat(connector.getEndpointResolution()).isEqualTo(EndpointResolution.GEOMETRIC);
        assertThat(connector.getEndpointConfidence()).isLessThan(0.9);
    }

    @Test
    void infersDiagramType_fromMetadataKeywords_unlessRootDeclaresOne() {
        String fromMetadata = "<svg xmlns=\"http://www.w3.org/2000/svg\"><metadata>PlantUML sequence diagram</metadata></svg>";
        String declared = "<svg xmlns=\"http://www.w3.org/2000/svg\" data-diagram-type=\"deployment\">"
                + "<metadata>sequence</metadata></svg>";

        assertThat(analyzer.analyze(fromMetadata, "m").getDiagramType()).isEqualTo("sequence");
        assertThat(analyzer.analyze(declared, "d").getDiagramType()).isEqualTo("deployment");
    }

    @Test
    void ignoresShapesInsideDefs_andRecordsDuplicateIds() {
        String svg = """
                <svg xmlns="http://www.w3.org/2000/svg">
                  <defs><marker id="arrow"><path id="arrow_head" d="M0 0 L10 5 L0 10 z"/></marker></defs>
                  <rect id="dup" x="0" y="0" width="10" height="10"/>
                  <circle id="dup" cx="50" cy="50" r="5"/>
                </svg>
                """;

        StructuralGraph graph = analyzer.analyze(svg, "defs");

        assertThat(graph.getEdges()).isEmpty();
        assertThat(graph.getDuplicateIds()).containsExactly("dup");
    }

    @Test
    void rejectsMalformedMarkup() {
        assertThatThrownBy(() -> analyzer.analyze("<svg><g></svg>", "broken"))
                .isInstanceOf(SvgParseException.class);
    }

    @Test
    void joinsMixedContentLabel_inDocumentOrder() {
        String svg = "<svg xmlns=\"http://www.w3.org/2000/svg\"><g id=\"api\" data-kind=\"node\">"
                + "<rect x=\"0\" y=\"0\" width=\"10\" height=\"10\"/>"
                + "<text>Order <tspan font-weight=\"bold\">API</tspan> v2</text></g></svg>";

        SvgNode api = (SvgNode) analyzer.analyze(svg, "mixed").find("api").orElseThrow();

        assertThat(api.getLabel()).isEqualTo("Order API v2");
    }

    @Test
    void escapesIdsInSelectors_whenIdsAreNotCssIdentifiers() {
        String svg = """
                <svg xmlns="http://www.w3.org/2000/svg">
                  <g id="1st.node" data-kind="node"><rect x="0" y="0" width="10" height="10"/><text>First</text></g>
                  <line id="a:b" x1="10" y1="5" x2="50" y2="5"/>
                </svg>
                """;

        StructuralGraph graph = analyzer.analyze(svg, "escaped");

        SvgNode node = (SvgNode) graph.find("1st.node").orElseThrow();
        assertThat(node.getSelector()).isEqualTo("#\\31 st\\.node");
        assertThat(node.getAnimatableSelector()).isEqualTo("#\\31 st\\.node rect");
        assertThat(node.getTextSelector()).isEqualTo("#\\31 st\\.node text");
        assertThat(graph.getEdges()).anySatisfy(edge -> {
            assertThat(edge.getId()).isEqualTo("a:b");
            assertThat(edge.getAnimatableSelector()).isEqualTo("#a\\:b");
        });
    }
}
