package com.architecture.diagram.irengine.service.transform;

import com.architecture.diagram.irengine.dto.invariance.InvarianceCheckResult;
import com.architecture.diagram.irengine.dto.invariance.InvariancePolicy;
import com.architecture.diagram.irengine.dto.invariance.InvarianceSettings;
import com.architecture.diagram.irengine.dto.invariance.TransformOutcome;
import com.architecture.diagram.irengine.dto.svg.AnalysisOptions;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.exception.SemanticInvarianceException;
import com.architecture.diagram.irengine.service.invariance.SemanticInvarianceChecker;
import com.architecture.diagram.irengine.service.svg.SvgDocument;
import com.architecture.diagram.irengine.service.svg.SvgDocumentParser;
import com.architecture.diagram.irengine.service.svg.SvgDocumentWriter;
import com.architecture.diagram.irengine.service.svg.SvgStructuralAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs cosmetic transforms over an SVG and gates the result on the semantic invariance check,
 * according to the configured {@link InvariancePolicy}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CosmeticTransformPipeline {

    private final SvgStructuralAnalyzer analyzer;
    private final SemanticInvarianceChecker invarianceChecker;
    private final InvarianceSettings settings;

    public TransformOutcome apply(String svgText, CosmeticTransform... transforms) {
        return apply(svgText, List.of(transforms));
    }

    public TransformOutcome apply(String svgText, List<CosmeticTransform> transforms) {
        SvgDocument original = SvgDocumentParser.parse(svgText);
        StructuralGraph graph = analyzer.analyze(original, "pre", AnalysisOptions.DEFAULT);

        SvgDocument current = original;
        for (CosmeticTransform transform : transforms) {
            current = transform.apply(current, graph);
        }
        List<String> names = transforms.stream().map(CosmeticTransform::name).toList();

        InvarianceCheckResult check = invarianceChecker.check(original, current, settings.isStrict());
        if (!check.isValid()) {
            if (settings.getPolicy() == InvariancePolicy.FAIL_CLOSED) {
                log.error("Rejecting output of {}: {}", names, check.getSummary());
                throw new SemanticInvarianceException(String.join(",", names), check);
            }
            log.warn("Transforms {} changed diagram semantics, returning output anyway: {}",
                    names, check.getSummary());
        } else {
            log.info("Applied transforms {} to SVG ({} nodes, {} edges)",
                    names, graph.getNodes().size(), graph.getEdges().size());
        }

        return TransformOutcome.builder()
                .svg(SvgDocumentWriter.write(current))
                .transforms(names)
                .check(check)
                .invariancePreserved(check.isValid())
                .build();
    }
}
