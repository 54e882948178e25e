package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.enrich.EnrichedEdge;
import com.architecture.diagram.irengine.dto.enrich.EnrichedIr;
import com.architecture.diagram.irengine.dto.enrich.EnrichedNode;
import com.architecture.diagram.irengine.dto.enrich.Layout;
import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.BoundingBox;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.EdgeDirection;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.service.schema.IrJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts an enriched IR into the canonical {@link IrDocument}, placing blocks in one band per zone.
 */
@Component
public class EnrichedIrMapper {

    static final double BLOCK_WIDTH = 140;
    static final double BLOCK_HEIGHT = 48;
    static final double MARGIN = 40;
    static final double GAP = 40;
    static final double BAND_GAP = 72;

    private final ObjectMapper objectMapper = IrJson.newMapper();

    public IrDocument toIrDocument(EnrichedIr enriched, String diagramId) {
        Map<String, BoundingBox> positions = layout(enriched);

        List<Block> blocks = new ArrayList<>();
        for (EnrichedNode node : enriched.getNodes()) {
            blocks.add(toBlock(node, positions.get(node.getNodeId())));
        }
        List<IrEdge> edges = new ArrayList<>();
        for (EnrichedEdge edge : enriched.getEdges()) {
            edges.add(toEdge(edge));
        }

        Diagram diagram = Diagram.builder()
                .id(diagramId)
                .type(enriched.getDiagramType())
                .blocks(blocks)
                .edges(edges)
                .layout(enriched.getLayout().getValue())
                .zoneOrder(new ArrayList<>(enriched.getZoneOrder()))
                .globalIntent(objectMapper.convertValue(enriched.getGlobalIntent(),
                        new TypeReference<TreeMap<String, Object>>() {}))
                .build();
        return new IrDocument(diagram);
    }

    private Block toBlock(EnrichedNode node, BoundingBox bbox) {
        Map<String, Object> style = new TreeMap<>();
        style.put("fill", node.getNodeStyle().getFillColor());
        style.put("stroke", node.getNodeStyle().getBorderColor());
        style.put("text_color", node.getNodeStyle().getTextColor());
        style.put("stroke_width", node.getNodeStyle().getBorderWidth());
        style.put("font_size", node.getNodeStyle().getFontSize());
        style.put("font_family", node.getNodeStyle().getFontFamily());
        style.put("padding", node.getNodeStyle().getPadding());
        style.put("shape", node.getShape());

        Map<String, Object> annotations = new TreeMap<>();
        annotations.put("role", node.getRole().getValue());
        annotations.put("stereotype", node.getStereotype());
        annotations.put("size_hint", node.getSizeHint());
        if (node.getMetadata() != null) {
            annotations.put("confidence", node.getMetadata().getConfidence());
            annotations.put("reason", node.getMetadata().getReason());
            annotations.put("source", node.getMetadata().getSource());
        }

        return Block.builder()
                .id(node.getNodeId())
                .type(node.getType().getValue())
                .text(node.getLabel())
                .bbox(bbox)
                .style(style)
                .annotations(annotations)
                .zone(node.getZone() != null ? node.getZone().getValue() : null)
                .build();
    }

    private IrEdge toEdge(EnrichedEdge edge) {
        IrEdge irEdge = IrEdge.builder()
                .edgeId(edge.getEdgeId())
                .from(edge.getFromId())
                .to(edge.getToId())
                .relationType(edge.getRelType().getValue())
                .direction(EdgeDirection.UNIDIRECTIONAL)
                .category(edge.getRelType().getCategory())
                .mode(edge.getRelType().getMode())
                .label(edge.getLabel())
                .confidence(edge.getConfidence())
                .inferred(edge.isInferred() ? Boolean.TRUE : null)
                .build();

        Map<String, Object> style = new TreeMap<>();
        style.put("line", edge.getStyle());
        style.put("color", edge.getColor());
        style.put("width", edge.getWidth());
        style.put("arrowhead", edge.getArrowhead());
        style.put("curvature", edge.getCurvature());
        style.put("opacity", edge.getOpacity());
        irEdge.putExtension("style", style);
        irEdge.putExtension("reason", edge.getReason());
        return irEdge;
    }

    // ========================= LAYOUT =========================

    /**
     * One band per zone in zone order, unzoned nodes in a trailing band. Bands are rows for
     * vertical layouts and columns for horizontal ones; grid ignores zones.
     */
    private Map<String, BoundingBox> layout(EnrichedIr enriched) {
        Layout layout = enriched.getLayout();
        List<EnrichedNode> nodes = enriched.getNodes();
        Map<String, BoundingBox> positions = new LinkedHashMap<>();

        if (layout == Layout.GRID) {
            int columns = (int) Math.ceil(Math.sqrt(Math.max(nodes.size(), 1)));
            for (int i = 0; i < nodes.size(); i++) {
                positions.put(nodes.get(i).getNodeId(), cell(i / columns, i % columns, false));
            }
            return positions;
        }

        Map<Integer, List<EnrichedNode>> bands = new TreeMap<>();
        List<String> zoneOrder = enriched.getZoneOrder();
        for (EnrichedNode node : nodes) {
            int band = node.getZone() == null ? zoneOrder.size() : zoneOrder.indexOf(node.getZone().getValue());
            bands.computeIfAbsent(band < 0 ? zoneOrder.size() : band, b -> new ArrayList<>()).add(node);
        }
        List<List<EnrichedNode>> ordered = new ArrayList<>(bands.values());
        if (layout == Layout.BOTTOM_UP || layout == Layout.RIGHT_LEFT) {
            Collections.reverse(ordered);
        }
        for (int band = 0; band < ordered.size(); band++) {
            List<EnrichedNode> members = ordered.get(band);
            for (int slot = 0; slot < members.size(); slot++) {
                positions.put(members.get(slot).getNodeId(), cell(band, slot, layout.isHorizontal()));
            }
        }
        return positions;
    }

    private BoundingBox cell(int band, int slot, boolean horizontal) {
        double across = MARGIN + slot * (horizontal ? BLOCK_HEIGHT + GAP : BLOCK_WIDTH + GAP);
        double along = MARGIN + band * (horizontal ? BLOCK_WIDTH + BAND_GAP : BLOCK_HEIGHT + BAND_GAP);
        return horizontal
                ? new BoundingBox(along, across, BLOCK_WIDTH, BLOCK_HEIGHT)
                : new BoundingBox(across, along, BLOCK_WIDTH, BLOCK_HEIGHT);
    }
}
