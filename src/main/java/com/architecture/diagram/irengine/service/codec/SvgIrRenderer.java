package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.BoundingBox;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.exception.IrEngineException;
import com.architecture.diagram.irengine.service.schema.IrJson;
import com.architecture.diagram.irengine.service.svg.SvgDocument;
import com.architecture.diagram.irengine.service.svg.SvgDocumentParser;
import com.architecture.diagram.irengine.service.svg.SvgDocumentWriter;
import com.architecture.diagram.irengine.service.svg.SvgStructuralAnalyzer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in neutral renderer from IR to SVG, used when no external renderer is configured.
 *
 * Each visible block becomes {@code <g id=blockId data-kind="node">} holding a rect and a text,
 * each edge between visible blocks a {@code <g data-kind="edge">} whose line carries the edge id,
 * and each zone a {@code boundary_<zone>} group drawn behind its members. The IR itself travels
 * in {@code <metadata id="ir_metadata">} so the SVG can be read back.
 */
@Component
@Slf4j
public class SvgIrRenderer {

    static final String NODE_FILL = "#FFFFFF";
    static final String INK = "#0F172A";
    static final String BOUNDARY_PREFIX = "boundary_";
    static final String ARROW_MARKER_ID = "ir-arrow";

    private static final double CANVAS_MARGIN = 40;
    private static final double BOUNDARY_PADDING = 16;
    private static final double BOUNDARY_LABEL_SPACE = 20;

    private final ObjectMapper objectMapper = IrJson.newMapper();

    public String render(IrDocument ir) {
        Diagram diagram = ir.getDiagram();
        Map<String, Block> visible = new LinkedHashMap<>();
        diagram.getBlocks().stream()
                .filter(b -> !b.hidden())
                .forEach(b -> visible.put(b.getId(), b));
        List<IrEdge> edges = diagram.getEdges().stream()
                .filter(e -> visible.containsKey(e.getFrom()) && visible.containsKey(e.getTo()))
                .toList();

        double width = SvgStructuralAnalyzer.DEFAULT_WIDTH;
        double height = SvgStructuralAnalyzer.DEFAULT_HEIGHT;
        if (!visible.isEmpty()) {
            width = 0;
            height = 0;
            for (Block block : visible.values()) {
                BoundingBox box = bbox(block);
                width = Math.max(width, box.getX() + box.getW() + CANVAS_MARGIN);
                height = Math.max(height, box.getY() + box.getH() + CANVAS_MARGIN);
            }
        }

        String shell = "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"" + number(width)
                + "\" height=\"" + number(height) + "\" viewBox=\"0 0 " + number(width) + " " + number(height)
                + "\"/>";
        SvgDocument.Builder builder = SvgDocumentParser.parse(shell).toBuilder();
        builder.setAttribute(0, "data-diagram-type", diagram.getType() != null ? diagram.getType() : "architecture");

        writeDefs(builder);
        builder.appendChild(0, "metadata", attrs("id", SvgStructuralAnalyzer.METADATA_ID),
                metadataJson(diagram, visible, edges));
        writeBoundaries(builder, visible);
        for (IrEdge edge : edges) {
            writeEdge(builder, edge, visible);
        }
        for (Block block : visible.values()) {
            writeNode(builder, block);
        }

        String svg = SvgDocumentWriter.write(builder.build());
        log.debug("Rendered diagram {} to SVG: {} nodes, {} edges", diagram.getId(), visible.size(), edges.size());
        return svg;
    }

    // ========================= ELEMENTS =========================

    private void writeDefs(SvgDocument.Builder builder) {
        int defs = builder.appendChild(0, "defs", Map.of(), null);
        int marker = builder.appendChild(defs, "marker", attrs(
                "id", ARROW_MARKER_ID,
                "viewBox", "0 0 10 10",
                "refX", "10",
                "refY", "5",
                "markerWidth", "8",
                "markerHeight", "8",
                "orient", "auto-start-reverse"), null);
        builder.appendChild(marker, "path", attrs("d", "M 0 0 L 10 5 L 0 10 z", "fill", INK), null);
    }

    private void writeBoundaries(SvgDocument.Builder builder, Map<String, Block> visible) {
        Map<String, double[]> extents = new LinkedHashMap<>();
        for (Block block : visible.values()) {
            if (block.getZone() == null) {
                continue;
            }
            BoundingBox box = bbox(block);
            double[] e = extents.computeIfAbsent(block.getZone(), z -> new double[]{
                    Double.MAX_VALUE, Double.MAX_VALUE, -Double.MAX_VALUE, -Double.MAX_VALUE});
            e[0] = Math.min(e[0], box.getX());
            e[1] = Math.min(e[1], box.getY());
            e[2] = Math.max(e[2], box.getX() + box.getW());
            e[3] = Math.max(e[3], box.getY() + box.getH());
        }
        extents.forEach((zone, e) -> {
            double x = e[0] - BOUNDARY_PADDING;
            double y = e[1] - BOUNDARY_PADDING - BOUNDARY_LABEL_SPACE;
            int group = builder.appendChild(0, "g", attrs(
                    "id", BOUNDARY_PREFIX + zone,
                    "data-kind", "boundary",
                    "data-zone", zone,
                    "class", "ir-boundary"), null);
            builder.appendChild(group, "rect", attrs(
                    "x", number(x),
                    "y", number(y),
                    "width", number(e[2] - e[0] + 2 * BOUNDARY_PADDING),
                    "height", number(e[3] - e[1] + 2 * BOUNDARY_PADDING + BOUNDARY_LABEL_SPACE),
                    "rx", "12",
                    "fill", "none",
                    "stroke", INK,
                    "stroke-dasharray", "6 4"), null);
            builder.appendChild(group, "text", attrs(
                    "x", number(x + 8),
                    "y", number(y + 16),
                    "font-size", "12"), zone);
        });
    }

    private void writeNode(SvgDocument.Builder builder, Block block) {
        BoundingBox box = bbox(block);
        Map<String, String> groupAttrs = attrs(
                "id", block.getId(),
                "data-kind", "node",
                "data-type", block.getType() != null ? block.getType() : StructuralIrMapper.DEFAULT_KIND,
                "class", "ir-node");
        if (block.getZone() != null) {
            groupAttrs.put("data-zone", block.getZone());
        }
        int group = builder.appendChild(0, "g", groupAttrs, null);
        builder.appendChild(group, "rect", attrs(
                "id", block.getId() + "_rect",
                "x", number(box.getX()),
                "y", number(box.getY()),
                "width", number(box.getW()),
                "height", number(box.getH()),
                "rx", "8",
                "fill", styleValue(block.getStyle(), "fill", NODE_FILL),
                "stroke", styleValue(block.getStyle(), "stroke", INK)), null);
        builder.appendChild(group, "text", attrs(
                "id", block.getId() + "_text",
                "x", number(box.centerX()),
                "y", number(box.centerY()),
                "text-anchor", "middle",
                "dominant-baseline", "middle",
                "fill", styleValue(block.getStyle(), "text_color", INK)), block.getText());
    }

    private void writeEdge(SvgDocument.Builder builder, IrEdge edge, Map<String, Block> visible) {
        BoundingBox from = bbox(visible.get(edge.getFrom()));
        BoundingBox to = bbox(visible.get(edge.getTo()));
        Map<String, Object> style = edgeStyle(edge);

        int group = builder.appendChild(0, "g", attrs(
                "id", edge.getEdgeId() + "_group",
                "data-kind", "edge",
                "data-source", edge.getFrom(),
                "data-target", edge.getTo(),
                "data-role", edge.getRelationType() != null ? edge.getRelationType() : "directed",
                "class", "ir-edge"), null);
        Map<String, String> lineAttrs = attrs(
                "id", edge.getEdgeId(),
                "x1", number(from.centerX()),
                "y1", number(from.centerY()),
                "x2", number(to.centerX()),
                "y2", number(to.centerY()),
                "stroke", styleValue(style, "color", INK),
                "stroke-width", styleValue(style, "width", "1"),
                "marker-end", "url(#" + ARROW_MARKER_ID + ")");
        if ("dashed".equals(style.get("line"))) {
            lineAttrs.put("stroke-dasharray", "6 4");
        }
        builder.appendChild(group, "line", lineAttrs, null);
        if (edge.getLabel() != null && !edge.getLabel().isBlank()) {
            builder.appendChild(group, "text", attrs(
                    "x", number((from.centerX() + to.centerX()) / 2),
                    "y", number((from.centerY() + to.centerY()) / 2 - 4),
                    "text-anchor", "middle",
                    "font-size", "11"), edge.getLabel());
        }
    }

    private String metadataJson(Diagram diagram, Map<String, Block> visible, List<IrEdge> edges) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("diagram_id", diagram.getId());
        payload.put("diagram_type", diagram.getType());
        payload.put("layout", diagram.getLayout());
        ArrayNode zoneOrder = payload.putArray("zone_order");
        if (diagram.getZoneOrder() != null) {
            diagram.getZoneOrder().forEach(zoneOrder::add);
        }
        ArrayNode nodes = payload.putArray("nodes");
        visible.values().forEach(b -> nodes.add(objectMapper.valueToTree(b)));
        ArrayNode edgeArray = payload.putArray("edges");
        edges.forEach(e -> edgeArray.add(objectMapper.valueToTree(e)));
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IrEngineException("Failed to serialize SVG metadata for diagram " + diagram.getId(), e);
        }
    }

    // ========================= HELPERS =========================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> edgeStyle(IrEdge edge) {
        Object style = edge.getExtensions().get("style");
        return style instanceof Map ? (Map<String, Object>) style : Map.of();
    }

    private static BoundingBox bbox(Block block) {
        return block.getBbox() != null ? block.getBbox() : new BoundingBox(0, 0, 0, 0);
    }

    private static String styleValue(Map<String, Object> style, String key, String fallback) {
        Object value = style != null ? style.get(key) : null;
        if (value == null) {
            return fallback;
        }
        return value instanceof Number ? number(((Number) value).doubleValue()) : value.toString();
    }

    private static Map<String, String> attrs(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
