package com.architecture.diagram.irengine.service.schema;

import com.architecture.diagram.irengine.dto.ir.DiffSummary;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.diagram.irengine.IrFixtures.block;
import static com.architecture.diagram.irengine.IrFixtures.document;
import static com.architecture.diagram.irengine.IrFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;

class IrDifferTest {

    private final IrDiffer differ = new IrDiffer();

    @Test
    void reportsAddedRemovedAndModifiedElements() {
        IrDocument before = document("d",
                List.of(block("a", "A"), block("b", "B"), block("c", "C")),
                List.of(edge("e1", "a", "b"), edge("e2", "b", "c")));
        IrDocument after = document("d",
                List.of(block("a", "A"), block("b", "B prime"), block("d", "D")),
                List.of(edge("e1", "a", "b"), edge("e3", "a", "d")));

        DiffSummary diff = differ.diff(before.getDiagram(), after.getDiagram());

        assertThat(diff.getBlocksAdded()).containsExactly("d");
        assertThat(diff.getBlocksRemoved()).containsExactly("c");
        assertThat(diff.getBlocksModified()).containsExactly("b");
        assertThat(diff.getEdgesAdded()).containsExactly("e3");
        assertThat(diff.getEdgesRemoved()).containsExactly("e2");
        assertThat(diff.getDescription()).isEqualTo("blocks=3->3; edges=2->2");
    }

    @Test
    void reportsNothing_forIdenticalDiagrams() {
        IrDocument doc = document("d", List.of(block("a", "A")), List.of());

        DiffSummary diff = differ.diff(doc.getDiagram(), doc.getDiagram());

        assertThat(diff.getBlocksAdded()).isEmpty();
        assertThat(diff.getBlocksRemoved()).isEmpty();
        assertThat(diff.getBlocksModified()).isEmpty();
        assertThat(diff.getBlocksBefore()).isEqualTo(diff.getBlocksAfter());
    }
}
