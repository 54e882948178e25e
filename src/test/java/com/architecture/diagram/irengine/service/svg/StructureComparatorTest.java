package com.architecture.diagram.irengine.service.svg;

import com.architecture.diagram.irengine.dto.invariance.Severity;
import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.StructureComparison;
import com.architecture.diagram.irengine.dto.svg.StructureDifference.DifferenceType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructureComparatorTest {

    private static final String BASE = """
            <svg xmlns="http://www.w3.org/2000/svg" width="600" height="300">
              <g id="zone_edge" data-kind="boundary"><rect x="0" y="0" width="300" height="300"/></g>
              <g id="a" data-kind="node"><rect x="20" y="20" width="80" height="40"/><text>A</text></g>
              <g id="b" data-kind="node"><rect x="400" y="20" width="80" height="40"/><text>B</text></g>
              <g id="c" data-kind="node"><rect x="400" y="200" width="80" height="40"/><text>C</text></g>
              <g id="e1_group" data-kind="edge" data-source="a" data-target="b"><line id="e1" x1="100" y1="40" x2="400" y2="40"/></g>
            </svg>
            """;

    private final SvgStructuralAnalyzer analyzer = new SvgStructuralAnalyzer(AnalysisOptions.DEFAULT);
    private final StructureComparator comparator = new StructureComparator();

    @Test
    void reportsEquivalence_forIdenticalStructure() {
        StructuralGraph original = analyzer.analyze(BASE, "original");
        StructuralGraph modified = analyzer.analyze(BASE.replace("<text>A</text>", "<text>Renamed</text>"), "modified");

        StructureComparison comparison = comparator.compare(original, modified);

        assertThat(comparison.isEquivalent()).isTrue();
        assertThat(comparison.getDifferences()).isEmpty();
        assertThat(comparison.getOriginalStats()).containsEntry("nodes", 3).containsEntry("edges", 1);
    }

    @Test
    void flagsReconnectedEdge_asError() {
        StructuralGraph original = analyzer.analyze(BASE, "original");
        StructuralGraph modified = analyzer.analyze(BASE.replace("data-target=\"b\"", "data-target=\"c\""), "modified");

        StructureComparison comparison = comparator.compare(original, modified);

        assertThat(comparison.isEquivalent()).isFalse();
        assertThat(comparison.getDifferences())
                .withFailMessage("Expected a reconnection entry for e1, got %s", comparison.getDifferences())
                .anySatisfy(d -> {
                    assertThat(d.getType()).isEqualTo(DifferenceType.EDGE_RECONNECTED);
                    assertThat(d.getElementIds()).containsExactly("e1");
                    assertThat(d.getBefore()).isEqualTo("a->b");
                    assertThat(d.getAfter()).isEqualTo("a->c");
                });
    }

    @Test
    void flagsAddedAndRemovedNodes() {
        StructuralGraph original = analyzer.analyze(BASE, "original");
        String modifiedSvg = BASE
                .replace("<g id=\"c\"", "<g id=\"d\"")
                .replace("<text>C</text>", "<text>D</text>");

        StructureComparison comparison = comparator.compare(original, analyzer.analyze(modifiedSvg, "modified"));

        assertThat(comparison.getDifferences()).anySatisfy(d -> {
            assertThat(d.getType()).isEqualTo(DifferenceType.NODES_ADDED);
            assertThat(d.getElementIds()).containsExactly("d");
        });
        assertThat(comparison.getDifferences()).anySatisfy(d -> {
            assertThat(d.getType()).isEqualTo(DifferenceType.NODES_REMOVED);
            assertThat(d.getElementIds()).containsExactly("c");
        });
        assertThat(comparison.countBySeverity(Severity.ERROR)).isEqualTo(2);
    }

    @Test
    void treatsGroupMembershipChange_asWarningOnly() {
        StructuralGraph original = analyzer.analyze(BASE, "original");
        // Move A out of the boundary
        String moved = BASE.replace("<rect x=\"20\" y=\"20\"", "<rect x=\"320\" y=\"120\"");

        StructureComparison comparison = comparator.compare(original, analyzer.analyze(moved, "modified"));

        assertThat(comparison.isEquivalent()).isTrue();
        assertThat(comparison.getDifferences()).singleElement().satisfies(d -> {
            assertThat(d.getType()).isEqualTo(DifferenceType.GROUP_MEMBERSHIP_CHANGED);
            assertThat(d.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(d.getBefore()).isEqualTo("zone_edge");
            assertThat(d.getAfter()).isNull();
        });
    }
}
