package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.enrich.EnrichedEdge;
import com.architecture.diagram.irengine.dto.enrich.EnrichedNode;
import com.architecture.diagram.irengine.dto.enrich.EnrichmentMetadata.ValidationMessage;
import com.architecture.diagram.irengine.dto.enrich.InferenceRecord;
import com.architecture.diagram.irengine.dto.enrich.InferenceRule;
import com.architecture.diagram.irengine.dto.enrich.RelationType;
import com.architecture.diagram.irengine.dto.enrich.TextStyle;
import com.architecture.diagram.irengine.dto.plan.Zone;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Working state of a single enrichment run. Not shared between runs.
 */
@Getter
class EnrichmentContext {

    static final double INFERRED_OPACITY = 0.6;
    static final double GUARD_OPACITY = 0.4;

    private final List<String> palette;
    private final List<Zone> zoneOrder;

    private final List<EnrichedNode> nodes = new ArrayList<>();
    private final Map<String, EnrichedNode> nodesByLabel = new HashMap<>();
    private final Set<String> nodeIds = new HashSet<>();

    private final List<EnrichedEdge> edges = new ArrayList<>();
    private final Set<String> edgeIds = new HashSet<>();

    private final List<InferenceRecord> inferences = new ArrayList<>();
    private final List<ValidationMessage> validation = new ArrayList<>();

    EnrichmentContext(List<String> palette, List<Zone> zoneOrder) {
        this.palette = palette;
        this.zoneOrder = zoneOrder;
    }

    EnrichedNode findByLabel(String label) {
        return nodesByLabel.get(labelKey(label));
    }

    void addNode(EnrichedNode node) {
        nodes.add(node);
        nodesByLabel.put(labelKey(node.getLabel()), node);
        nodeIds.add(node.getNodeId());
    }

    void addEdge(EnrichedEdge edge) {
        edges.add(edge);
        edgeIds.add(edge.getEdgeId());
    }

    void warn(String message) {
        validation.add(new ValidationMessage("warning", message));
    }

    void info(String message) {
        validation.add(new ValidationMessage("info", message));
    }

    /**
     * Zone rank in the resolved order; unzoned nodes sort after every zone.
     */
    int zoneRank(Zone zone) {
        int rank = zone == null ? -1 : zoneOrder.indexOf(zone);
        return rank < 0 ? zoneOrder.size() : rank;
    }

    String paletteColor(int index) {
        return palette.get(Math.floorMod(index, palette.size()));
    }

    /**
     * Add a dashed, lower-opacity edge together with its audit record.
     */
    EnrichedEdge addInferredEdge(EnrichedNode from, EnrichedNode to, RelationType type,
                                 InferenceRule rule, String reason) {
        String edgeId = uniqueId(from.getNodeId() + "__" + to.getNodeId() + "__inferred", edgeIds);
        String color = paletteColor(1);
        EnrichedEdge edge = EnrichedEdge.builder()
                .edgeId(edgeId)
                .fromId(from.getNodeId())
                .toId(to.getNodeId())
                .relType(type)
                .label(reason)
                .style("dashed")
                .color(color)
                .width(1)
                .arrowhead("open")
                .textStyle(new TextStyle(AestheticResolver.FONT_FAMILY, 11, color))
                .curvature(0.0)
                .opacity(rule == InferenceRule.COMPLETION_GUARD ? GUARD_OPACITY : INFERRED_OPACITY)
                .confidence(rule.getConfidence())
                .reason(reason)
                .inferred(true)
                .build();
        addEdge(edge);
        inferences.add(InferenceRecord.builder()
                .edgeId(edgeId)
                .fromId(edge.getFromId())
                .toId(edge.getToId())
                .rule(rule)
                .reason(reason)
                .confidence(rule.getConfidence())
                .build());
        return edge;
    }

    static String labelKey(String label) {
        return label.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    /**
     * Lowercase slug of {@code base}, suffixed {@code _2}, {@code _3}... until unused.
     */
    static String uniqueSlug(String base, Set<String> taken, String fallback) {
        String slug = base.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return uniqueId(slug.isEmpty() ? fallback : slug, taken);
    }

    static String uniqueId(String base, Set<String> taken) {
        String candidate = base;
        int counter = 2;
        while (taken.contains(candidate)) {
            candidate = base + "_" + counter++;
        }
        return candidate;
    }
}
