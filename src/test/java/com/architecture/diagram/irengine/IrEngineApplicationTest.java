package com.architecture.diagram.irengine;

import com.architecture.diagram.irengine.dto.codec.DiagramFormat;
import com.architecture.diagram.irengine.dto.codec.RenderedDiagram;
import com.architecture.diagram.irengine.dto.codec.SvgImportResult;
import com.architecture.diagram.irengine.dto.invariance.TransformOutcome;
import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.patch.FeedbackRequest;
import com.architecture.diagram.irengine.exception.StructuralIntegrityException;
import com.architecture.diagram.irengine.model.IrVersionRecord;
import com.architecture.diagram.irengine.service.codec.DiagramRenderService;
import com.architecture.diagram.irengine.service.codec.SvgIrReader;
import com.architecture.diagram.irengine.service.schema.IrJson;
import com.architecture.diagram.irengine.service.transform.AnimationCssInjector;
import com.architecture.diagram.irengine.service.transform.CosmeticTransformPipeline;
import com.architecture.diagram.irengine.service.version.DiagramVersionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class IrEngineApplicationTest {

    @Autowired
    private DiagramVersionService versionService;

    @Autowired
    private DiagramRenderService renderService;

    @Autowired
    private CosmeticTransformPipeline transformPipeline;

    @Autowired
    private AnimationCssInjector animationCssInjector;

    @Autowired
    private SvgIrReader svgIrReader;

    @Test
    void enrichesEditsRendersAndReadsBackADiagram() {
        IrVersionRecord created = versionService.createDiagram("login-flow", IrFixtures.browserAuthPostgresPlan());
        assertThat(created.getIrVersion()).isEqualTo(1);
        Block first = created.getVersion().diagram().getBlocks().get(0);

        IrVersionRecord edited = versionService.applyFeedback(FeedbackRequest.builder()
                .diagramId("login-flow")
                .action("edit_text")
                .blockId(first.getId())
                .payload(Map.of("text", "Web Browser"))
                .baseVersion(1)
                .build());
        assertThat(edited.getIrVersion()).isEqualTo(2);
        assertThat(edited.getParentVersion()).isEqualTo(1);
        assertThat(versionService.listHistory("login-flow")).hasSize(2);

        RenderedDiagram rendered = renderService.render(edited.getVersion().getIr(), DiagramFormat.PLANTUML);
        assertThat(rendered.getSource()).contains("Web Browser").contains("-->");
        assertThat(rendered.getSvg()).isNotBlank();

        TransformOutcome animated = transformPipeline.apply(rendered.getSvg(), animationCssInjector);
        assertThat(animated.isInvariancePreserved())
                .withFailMessage("animation changed diagram structure: %s", animated.getCheck())
                .isTrue();

        SvgImportResult readBack = svgIrReader.read(animated.getSvg(), "login-flow-copy");
        assertThat(readBack.getVersion().diagram().getBlockIds())
                .containsExactlyInAnyOrderElementsOf(edited.getVersion().diagram().getBlockIds());
        assertThat(readBack.getUnresolvedEdgeIds()).isEmpty();
    }

    @Test
    void rejectsFeedbackOnImportedDiagramWithDanglingEdge_andKeepsHistory() throws Exception {
        String legacy = """
                {
                  "diagram": {
                    "id": "legacy-flow",
                    "type": "architecture",
                    "blocks": [
                      {"id": "a", "type": "service", "text": "A", "bbox": {"x": 0, "y": 0, "w": 10, "h": 10}}
                    ],
                    "relations": [
                      {"from": "a", "to": "ghost", "label": "calls"}
                    ]
                  }
                }
                """;
        versionService.importVersion("legacy-flow", IrJson.newMapper().readTree(legacy));

        assertThatThrownBy(() -> versionService.applyFeedback(FeedbackRequest.builder()
                .diagramId("legacy-flow")
                .action("edit_text")
                .blockId("a")
                .payload(Map.of("text", "Ingest"))
                .build()))
                .isInstanceOf(StructuralIntegrityException.class);
        assertThat(versionService.listHistory("legacy-flow")).hasSize(1);
    }
}
