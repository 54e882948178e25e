package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.SvgImportResult;
import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.BoundingBox;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.EdgeCategory;
import com.architecture.diagram.irengine.dto.ir.EdgeDirection;
import com.architecture.diagram.irengine.dto.ir.EdgeMode;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.dto.ir.IrVersion;
import com.architecture.diagram.irengine.dto.svg.ElementRole;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.SvgEdge;
import com.architecture.diagram.irengine.dto.svg.SvgNode;
import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.architecture.diagram.irengine.service.schema.IrJson;
import com.architecture.diagram.irengine.service.schema.IrVersionFactory;
import com.architecture.diagram.irengine.service.svg.SvgStructuralAnalyzer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recovers an IR version from an SVG. The node groups present in the drawing decide which
 * blocks exist; the {@code ir_metadata} payload, when present, supplies everything else.
 * Edges that cannot be tied to two existing blocks are reported, never guessed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SvgIrReader {

    static final String DEFAULT_RELATION_TYPE = "relates_to";

    private final SvgStructuralAnalyzer analyzer;
    private final IrVersionFactory versionFactory;
    private final ObjectMapper objectMapper = IrJson.newMapper();

    public SvgImportResult read(String svg, String diagramId) {
        StructuralGraph graph = analyzer.analyze(svg, diagramId);
        JsonNode metadata = parseMetadata(graph);

        Map<String, Block> declaredBlocks = new HashMap<>();
        Map<String, IrEdge> declaredEdges = new HashMap<>();
        List<String> declaredEdgeOrder = new ArrayList<>();
        if (metadata != null) {
            for (JsonNode node : metadata.path("nodes")) {
                Block block = bind(node, Block.class);
                declaredBlocks.put(block.getId(), block);
            }
            for (JsonNode node : metadata.path("edges")) {
                IrEdge edge = bind(node, IrEdge.class);
                declaredEdges.put(edge.getEdgeId(), edge);
                declaredEdgeOrder.add(edge.getEdgeId());
            }
        }

        List<Block> blocks = new ArrayList<>();
        Set<String> blockIds = new HashSet<>();
        for (SvgNode node : graph.getNodes()) {
            if (node.getRole() != ElementRole.NODE || !blockIds.add(node.getId())) {
                continue;
            }
            blocks.add(toBlock(node, declaredBlocks.get(node.getId())));
        }

        List<IrEdge> edges = new ArrayList<>();
        Set<String> edgeIds = new HashSet<>();
        Set<String> unresolved = new LinkedHashSet<>();
        for (String edgeId : declaredEdgeOrder) {
            IrEdge edge = declaredEdges.get(edgeId);
            if (blockIds.contains(edge.getFrom()) && blockIds.contains(edge.getTo())) {
                edges.add(edge);
                edgeIds.add(edgeId);
            }
        }
        for (SvgEdge svgEdge : graph.getEdges()) {
            if (edgeIds.contains(svgEdge.getId())) {
                continue;
            }
            if (!svgEdge.isFullyResolved()) {
                unresolved.add(svgEdge.getId());
                continue;
            }
            edges.add(toEdge(svgEdge));
            edgeIds.add(svgEdge.getId());
        }
        declaredEdgeOrder.stream()
                .filter(id -> !edgeIds.contains(id))
                .forEach(unresolved::add);
        if (!unresolved.isEmpty()) {
            log.warn("SVG import for diagram {} left {} edge(s) unresolved: {}", diagramId, unresolved.size(), unresolved);
        }

        Diagram diagram = Diagram.builder()
                .id(diagramId)
                .type(metadata != null && metadata.hasNonNull("diagram_type")
                        ? metadata.get("diagram_type").asText() : graph.getDiagramType())
                .blocks(blocks)
                .edges(edges)
                .build();
        if (metadata != null) {
            diagram.setLayout(metadata.hasNonNull("layout") ? metadata.get("layout").asText() : null);
            if (metadata.path("zone_order").isArray() && metadata.path("zone_order").size() > 0) {
                List<String> zoneOrder = new ArrayList<>();
                metadata.path("zone_order").forEach(z -> zoneOrder.add(z.asText()));
                diagram.setZoneOrder(zoneOrder);
            }
        }

        IrVersion version = versionFactory.makeVersion(diagramId, new IrDocument(diagram), null);
        log.info("Read diagram {} from SVG: {} blocks, {} edges (metadata: {})",
                diagramId, blocks.size(), edges.size(), metadata != null);
        return SvgImportResult.builder()
                .version(version)
                .fromMetadata(metadata != null)
                .unresolvedEdgeIds(List.copyOf(unresolved))
                .build();
    }

    private JsonNode parseMetadata(StructuralGraph graph) {
        if (graph.getIrMetadata() == null || graph.getIrMetadata().isBlank()) {
            return null;
        }
        try {
            JsonNode tree = objectMapper.readTree(graph.getIrMetadata());
            return tree.isObject() ? tree : null;
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("/ir_metadata", "metadata is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T bind(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("/ir_metadata", "metadata entry could not be bound: " + e.getOriginalMessage(), e);
        }
    }

    private Block toBlock(SvgNode node, Block declared) {
        String label = node.getLabel() != null ? node.getLabel() : "";
        if (declared != null) {
            if (!label.isEmpty()) {
                declared.setText(label);
            }
            return declared;
        }
        String type = node.getAttributes() != null ? node.getAttributes().get("data-type") : null;
        return Block.builder()
                .id(node.getId())
                .type(type != null && !type.isBlank() ? type : StructuralIrMapper.DEFAULT_KIND)
                .text(label)
                .bbox(new BoundingBox(node.getBounds().getX(), node.getBounds().getY(),
                        node.getBounds().getWidth(), node.getBounds().getHeight()))
                .zone(node.getZone())
                .build();
    }

    private IrEdge toEdge(SvgEdge edge) {
        return IrEdge.builder()
                .edgeId(edge.getId())
                .from(edge.getSourceId())
                .to(edge.getTargetId())
                .relationType(edge.getEdgeType() != null ? edge.getEdgeType() : DEFAULT_RELATION_TYPE)
                .direction(EdgeDirection.UNIDIRECTIONAL)
                .category(EdgeCategory.CONTROL)
                .mode(EdgeMode.SYNC)
                .label(edge.getLabel() != null ? edge.getLabel() : "")
                .confidence(edge.getEndpointConfidence())
                .build();
    }
}
