package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchResult;
import com.architecture.diagram.irengine.exception.BlockNotFoundException;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import com.architecture.diagram.irengine.exception.StructuralIntegrityException;
import com.architecture.diagram.irengine.service.schema.IrDiffer;
import com.architecture.diagram.irengine.service.schema.IrSchemaValidator;
import com.architecture.diagram.irengine.service.schema.IrVersionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.architecture.diagram.irengine.IrFixtures.block;
import static com.architecture.diagram.irengine.IrFixtures.document;
import static com.architecture.diagram.irengine.IrFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatchEngineTest {

    private final PatchEngine engine = new PatchEngine(new IrVersionFactory(new IrSchemaValidator()), new IrDiffer());

    private IrDocument current;

    @BeforeEach
    void setUp() {
        current = document("pipeline",
                List.of(block("a", "Ingest"), block("b", "Transform"), block("c", "Load")),
                List.of(edge("a__b", "a", "b"), edge("b__c", "b", "c"), edge("a__c", "a", "c")));
    }

    @Test
    void removesBlockAndEveryTouchingEdge() {
        PatchResult result = engine.apply(new RemoveBlockPatch("b"), current);

        Diagram diagram = result.getIr().getDiagram();
        assertThat(diagram.getBlockIds()).containsExactly("a", "c");
        assertThat(diagram.getEdges()).extracting("edgeId").containsExactly("a__c");
        assertThat(result.getDiffSummary().getEdgesBefore()).isEqualTo(3);
        assertThat(result.getDiffSummary().getEdgesAfter()).isEqualTo(1);
        assertThat(result.getDiffSummary().getDescription()).isEqualTo("blocks=3->2; edges=3->1");

        @SuppressWarnings("unchecked")
        Map<String, Object> before = (Map<String, Object>) result.getPatchLog().get(0).getBefore();
        assertThat(before).containsEntry("text", "Transform").containsEntry("removed_edges", List.of("a__b", "b__c"));
    }

    @Test
    void leavesInputDocumentUntouched() {
        PatchResult result = engine.apply(new EditTextPatch("a", "Collect"), current);

        Block edited = result.getIr().getDiagram().findBlock("a").orElseThrow();
        assertThat(edited.getText()).isEqualTo("Collect");
        assertThat(edited.getVersion()).isEqualTo(2);
        assertThat(current.getDiagram().findBlock("a").orElseThrow().getText()).isEqualTo("Ingest");
        assertThat(current.getDiagram().findBlock("a").orElseThrow().getVersion()).isEqualTo(1);
        assertThat(result.getDiffSummary().getBlocksModified()).containsExactly("a");
    }

    @Test
    void rejectsPatch_whenAnyEdgeIsOrphaned() {
        current.getDiagram().getEdges().add(edge("a__ghost", "a", "ghost"));

        assertThatThrownBy(() -> engine.apply(new EditTextPatch("a", "Collect"), current))
                .isInstanceOf(StructuralIntegrityException.class)
                .satisfies(e -> assertThat(((StructuralIntegrityException) e).getOrphanedEdgeIds())
                        .containsExactly("a__ghost"));
    }

    @Test
    void appliesPatchListAsOneUnit() {
        List<BlockPatch> patches = List.of(new EditTextPatch("a", "Collect"), new EditTextPatch("zzz", "nope"));

        assertThatThrownBy(() -> engine.apply(patches, current)).isInstanceOf(BlockNotFoundException.class);
        assertThat(current.getDiagram().findBlock("a").orElseThrow().getText()).isEqualTo("Ingest");
    }

    @Test
    void assignsFirstFreeBlockId_whenAddingWithoutId() {
        current.getDiagram().getBlocks().add(block("block-5", "Taken"));

        PatchResult result = engine.apply(AddBlockPatch.builder().text("Audit").build(), current);

        assertThat(result.getPatchLog()).singleElement().satisfies(entry -> {
            assertThat(entry.getOp()).isEqualTo(FeedbackAction.ADD_BLOCK);
            assertThat(entry.getBlockId()).isEqualTo("block-6");
        });
        assertThat(result.getIr().getDiagram().findBlock("block-6").orElseThrow().getType()).isEqualTo("component");
    }

    @Test
    void refusesToAddBlockWithExistingId() {
        assertThatThrownBy(() -> engine.apply(AddBlockPatch.builder().id("a").build(), current))
                .isInstanceOf(PatchValidationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void hidesBlock_butKeepsItsEdges() {
        PatchResult result = engine.apply(new VisibilityPatch("b", true), current);

        assertThat(result.getIr().getDiagram().findBlock("b").orElseThrow().hidden()).isTrue();
        assertThat(result.getIr().getDiagram().getEdges()).hasSize(3);
        assertThat(result.getPatchLog().get(0).getOp()).isEqualTo(FeedbackAction.HIDE);
    }

    @Test
    void mergesStyleKeys_andKeepsUnmentionedOnes() {
        current.getDiagram().findBlock("a").orElseThrow().getStyle().put("stroke", "#000000");

        PatchResult result = engine.apply(new StylePatch("a", Map.of("fill", "#FFFFFF")), current);

        assertThat(result.getIr().getDiagram().findBlock("a").orElseThrow().getStyle())
                .containsEntry("fill", "#FFFFFF")
                .containsEntry("stroke", "#000000");
    }

    @Test
    void repositionsOnlyGivenCoordinates() {
        PatchResult result = engine.apply(new RepositionPatch("c", 300.0, null, null, null), current);

        Block moved = result.getIr().getDiagram().findBlock("c").orElseThrow();
        assertThat(moved.getBbox().getX()).isEqualTo(300.0);
        assertThat(moved.getBbox().getW()).isEqualTo(120.0);
    }

    @Test
    void rejectsNegativeSize_onReposition() {
        assertThatThrownBy(() -> engine.apply(new RepositionPatch("c", null, null, -5.0, null), current))
                .isInstanceOf(PatchValidationException.class);
    }
}
