package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.StructuralEdge;
import com.architecture.diagram.irengine.dto.codec.StructuralGroup;
import com.architecture.diagram.irengine.dto.codec.StructuralIr;
import com.architecture.diagram.irengine.dto.codec.StructuralNode;
import com.architecture.diagram.irengine.dto.enrich.Layout;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MermaidCodecTest {

    private final MermaidCodec codec = new MermaidCodec(new ContentFingerprint());

    @Test
    void writesFlowchartWithSubgraphsShapesAndLabels() {
        StructuralIr ir = StructuralIr.builder()
                .layout(Layout.LEFT_RIGHT)
                .nodes(List.of(
                        StructuralNode.builder().id("api").kind("component").label("API").group("core").build(),
                        StructuralNode.builder().id("db").kind("database").label("Orders").build()))
                .groups(List.of(StructuralGroup.builder().id("core").label("Core Services").members(List.of("api")).build()))
                .edges(List.of(StructuralEdge.builder().id("e1").from("api").to("db").type("data").label("reads").build()))
                .build();

        List<String> lines = Arrays.asList(codec.encode(ir).split("\n"));

        assertThat(lines.get(0)).isEqualTo("flowchart LR");
        assertThat(lines).containsSubsequence(
                "    subgraph core[\"Core Services\"]",
                "        api[\"API\"]",
                "    end",
                "    db[(\"Orders\")]",
                "    api -->|reads| db");
        assertThat(lines.get(lines.size() - 1)).isEqualTo("%% fingerprint: " + codec.fingerprint(ir));
    }

    @Test
    void defaultsToTopDown_andCommentsUnresolvedEdges() {
        StructuralIr ir = StructuralIr.builder()
                .nodes(List.of(StructuralNode.builder().id("a").label("A").build()))
                .unresolved(List.of(StructuralEdge.builder().id("loose").from(null).to("a").build()))
                .build();

        String encoded = codec.encode(ir);

        assertThat(encoded).startsWith("flowchart TB");
        assertThat(encoded).contains("    %% unresolved loose: ? to a");
        assertThat(encoded).doesNotContain("-->");
    }

    @Test
    void writesSequenceDiagramMessages_withDefaultLabel() {
        StructuralIr ir = StructuralIr.builder()
                .diagramKind("sequence")
                .nodes(List.of(
                        StructuralNode.builder().id("user").kind("person").label("User").build(),
                        StructuralNode.builder().id("svc").kind("component").label("Service").build()))
                .edges(List.of(StructuralEdge.builder().id("m1").from("user").to("svc").order(1).build()))
                .build();

        String encoded = codec.encode(ir);

        assertThat(encoded).startsWith("sequenceDiagram");
        assertThat(encoded).contains("    actor user as User", "    participant svc as Service", "    user->>svc: call");
    }
}
