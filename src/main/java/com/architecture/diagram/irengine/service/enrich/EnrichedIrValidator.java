package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.enrich.EnrichedEdge;
import com.architecture.diagram.irengine.dto.enrich.EnrichedIr;
import com.architecture.diagram.irengine.dto.enrich.EnrichedNode;
import com.architecture.diagram.irengine.dto.enrich.InferenceRecord;
import com.architecture.diagram.irengine.dto.enrich.NodeStyle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks applied to every enriched document before it is returned.
 */
@Component
public class EnrichedIrValidator {

    static final double MAX_ISOLATION_RATIO = 0.15;

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-F]{6}$");

    /**
     * @return problems as {@code path: message}; empty when valid
     */
    public List<String> validate(EnrichedIr ir) {
        List<String> problems = new ArrayList<>();
        if (ir.getLayout() == null) {
            problems.add("layout: missing");
        }
        validatePalette(ir, problems);

        Set<String> nodeIds = new HashSet<>();
        List<EnrichedNode> nodes = ir.getNodes() != null ? ir.getNodes() : List.of();
        for (int i = 0; i < nodes.size(); i++) {
            validateNode(nodes.get(i), "nodes/" + i, nodeIds, problems);
        }

        Map<String, Integer> degree = new HashMap<>();
        Set<String> edgeIds = new HashSet<>();
        Set<String> inferredEdgeIds = new HashSet<>();
        List<EnrichedEdge> edges = ir.getEdges() != null ? ir.getEdges() : List.of();
        for (int i = 0; i < edges.size(); i++) {
            EnrichedEdge edge = edges.get(i);
            String path = "edges/" + i;
            if (isBlank(edge.getEdgeId()) || !edgeIds.add(edge.getEdgeId())) {
                problems.add(path + "/edge_id: missing or duplicate '" + edge.getEdgeId() + "'");
            }
            if (!nodeIds.contains(edge.getFromId())) {
                problems.add(path + "/from_id: unknown node '" + edge.getFromId() + "'");
            }
            if (!nodeIds.contains(edge.getToId())) {
                problems.add(path + "/to_id: unknown node '" + edge.getToId() + "'");
            }
            if (edge.getRelType() == null) {
                problems.add(path + "/rel_type: missing");
            }
            if (!isColor(edge.getColor())) {
                problems.add(path + "/color: not a #RRGGBB colour '" + edge.getColor() + "'");
            }
            if (edge.getWidth() <= 0) {
                problems.add(path + "/width: must be positive");
            }
            if (edge.getConfidence() < 0.0 || edge.getConfidence() > 1.0) {
                problems.add(path + "/confidence: " + edge.getConfidence() + " outside [0, 1]");
            }
            if (isBlank(edge.getReason())) {
                problems.add(path + "/reason: missing");
            }
            if (edge.isInferred()) {
                inferredEdgeIds.add(edge.getEdgeId());
            }
            degree.merge(edge.getFromId(), 1, Integer::sum);
            degree.merge(edge.getToId(), 1, Integer::sum);
        }

        Set<String> recorded = new HashSet<>();
        List<InferenceRecord> inferences = ir.getInferences() != null ? ir.getInferences() : List.of();
        for (InferenceRecord record : inferences) {
            recorded.add(record.getEdgeId());
            if (record.getRule() == null || record.getConfidence() != record.getRule().getConfidence()) {
                problems.add("inferences/" + record.getEdgeId() + ": rule and confidence disagree");
            }
        }
        for (String edgeId : inferredEdgeIds) {
            if (!recorded.contains(edgeId)) {
                problems.add("inferences: no record for inferred edge '" + edgeId + "'");
            }
        }

        // A single node cannot have a neighbour
        if (nodes.size() >= 2) {
            long isolated = nodes.stream().filter(n -> !degree.containsKey(n.getNodeId())).count();
            double ratio = (double) isolated / nodes.size();
            if (ratio > MAX_ISOLATION_RATIO) {
                problems.add(String.format("edges: %d of %d nodes are isolated", isolated, nodes.size()));
            }
        }
        return problems;
    }

    private void validatePalette(EnrichedIr ir, List<String> problems) {
        if (ir.getGlobalIntent() == null || ir.getGlobalIntent().getPalette() == null) {
            problems.add("global_intent/palette: missing");
            return;
        }
        List<String> palette = ir.getGlobalIntent().getPalette();
        if (palette.size() < 2 || palette.size() > 8) {
            problems.add("global_intent/palette: expected 2 to 8 colours, got " + palette.size());
        }
        for (String color : palette) {
            if (!isColor(color)) {
                problems.add("global_intent/palette: not a #RRGGBB colour '" + color + "'");
            }
        }
    }

    private void validateNode(EnrichedNode node, String path, Set<String> nodeIds, List<String> problems) {
        if (isBlank(node.getNodeId()) || !nodeIds.add(node.getNodeId())) {
            problems.add(path + "/node_id: missing or duplicate '" + node.getNodeId() + "'");
        }
        if (isBlank(node.getLabel())) {
            problems.add(path + "/label: missing");
        }
        if (node.getRole() == null || node.getType() == null) {
            problems.add(path + ": role and type are required");
        }
        NodeStyle style = node.getNodeStyle();
        if (style == null) {
            problems.add(path + "/node_style: missing");
        } else {
            for (String color : new String[]{style.getFillColor(), style.getBorderColor(), style.getTextColor()}) {
                if (!isColor(color)) {
                    problems.add(path + "/node_style: not a #RRGGBB colour '" + color + "'");
                }
            }
        }
        if (node.getMetadata() != null) {
            double confidence = node.getMetadata().getConfidence();
            if (confidence < 0.0 || confidence > 1.0) {
                problems.add(path + "/metadata/confidence: " + confidence + " outside [0, 1]");
            }
        }
    }

    private static boolean isColor(String value) {
        return value != null && HEX_COLOR.matcher(value).matches();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
