package com.architecture.diagram.irengine.service.codec;

import com.architecture.diagram.irengine.dto.codec.StructuralEdge;
import com.architecture.diagram.irengine.dto.codec.StructuralGroup;
import com.architecture.diagram.irengine.dto.codec.StructuralIr;
import com.architecture.diagram.irengine.dto.codec.StructuralNode;
import com.architecture.diagram.irengine.dto.enrich.Layout;
import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.IrDocument;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.dto.svg.ElementRole;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.SvgEdge;
import com.architecture.diagram.irengine.dto.svg.SvgGroup;
import com.architecture.diagram.irengine.dto.svg.SvgNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the renderer-neutral {@link StructuralIr} from a stored IR or from an analyzed SVG.
 */
@Component
@Slf4j
public class StructuralIrMapper {

    static final String DEFAULT_KIND = "component";

    /**
     * Hidden blocks and every edge touching one are left out. Blocks with a zone are grouped by
     * zone, in {@code zone_order} when the diagram declares one.
     */
    public StructuralIr fromIr(IrDocument ir) {
        Diagram diagram = ir.getDiagram();
        Set<String> visible = new HashSet<>();
        Set<String> known = new HashSet<>();
        List<StructuralNode> nodes = new ArrayList<>();
        Map<String, List<String>> zoneMembers = new LinkedHashMap<>();
        if (diagram.getZoneOrder() != null) {
            diagram.getZoneOrder().forEach(z -> zoneMembers.put(z, new ArrayList<>()));
        }

        for (Block block : diagram.getBlocks()) {
            known.add(block.getId());
            if (block.hidden()) {
                continue;
            }
            visible.add(block.getId());
            nodes.add(StructuralNode.builder()
                    .id(block.getId())
                    .kind(block.getType() != null ? block.getType() : DEFAULT_KIND)
                    .label(block.getText())
                    .group(block.getZone())
                    .build());
            if (block.getZone() != null) {
                zoneMembers.computeIfAbsent(block.getZone(), z -> new ArrayList<>()).add(block.getId());
            }
        }

        List<StructuralGroup> groups = new ArrayList<>();
        zoneMembers.forEach((zone, members) -> {
            if (!members.isEmpty()) {
                groups.add(StructuralGroup.builder().id(zone).label(zone).members(List.copyOf(members)).build());
            }
        });

        List<StructuralEdge> edges = new ArrayList<>();
        List<StructuralEdge> unresolved = new ArrayList<>();
        int order = 0;
        for (IrEdge edge : diagram.getEdges()) {
            order++;
            if (visible.contains(edge.getFrom()) && visible.contains(edge.getTo())) {
                edges.add(toStructuralEdge(edge, edge.getFrom(), edge.getTo(), order));
            } else if (!known.contains(edge.getFrom()) || !known.contains(edge.getTo())) {
                // endpoint missing from the diagram entirely, not merely hidden
                unresolved.add(toStructuralEdge(edge,
                        known.contains(edge.getFrom()) ? edge.getFrom() : null,
                        known.contains(edge.getTo()) ? edge.getTo() : null,
                        order));
            }
        }

        return StructuralIr.builder()
                .diagramKind(diagram.getType() != null ? diagram.getType() : "architecture")
                .layout(Layout.normalize(diagram.getLayout()))
                .title(diagram.getId())
                .nodes(nodes)
                .edges(edges)
                .groups(groups)
                .unresolved(unresolved)
                .build();
    }

    /**
     * Edges whose endpoints the analyzer could not resolve go to {@code unresolved}; they are
     * never attached to a guessed node.
     */
    public StructuralIr fromGraph(StructuralGraph graph) {
        List<StructuralNode> nodes = new ArrayList<>();
        for (SvgNode node : graph.getNodes()) {
            if (node.getRole() != ElementRole.NODE) {
                continue;
            }
            String kind = node.getAttributes() != null ? node.getAttributes().get("data-type") : null;
            nodes.add(StructuralNode.builder()
                    .id(node.getId())
                    .kind(kind != null && !kind.isBlank() ? kind : DEFAULT_KIND)
                    .label(node.getLabel())
                    .group(node.getParentId())
                    .build());
        }

        List<StructuralGroup> groups = new ArrayList<>();
        for (SvgGroup group : graph.getGroups()) {
            groups.add(StructuralGroup.builder()
                    .id(group.getId())
                    .label(group.getLabel())
                    .members(group.getMemberIds())
                    .build());
        }

        List<StructuralEdge> edges = new ArrayList<>();
        List<StructuralEdge> unresolved = new ArrayList<>();
        int order = 0;
        for (SvgEdge edge : graph.getEdges()) {
            order++;
            StructuralEdge mapped = StructuralEdge.builder()
                    .id(edge.getId())
                    .from(edge.getSourceId())
                    .to(edge.getTargetId())
                    .type(edge.getEdgeType())
                    .label(edge.getLabel())
                    .order(order)
                    .build();
            if (mapped.isResolved()) {
                edges.add(mapped);
            } else {
                unresolved.add(mapped);
            }
        }
        if (!unresolved.isEmpty()) {
            log.warn("SVG {} has {} edge(s) with unresolved endpoints", graph.getSvgId(), unresolved.size());
        }

        return StructuralIr.builder()
                .diagramKind(graph.getDiagramType())
                .title(graph.getSvgId())
                .nodes(nodes)
                .edges(edges)
                .groups(groups)
                .unresolved(unresolved)
                .build();
    }

    private StructuralEdge toStructuralEdge(IrEdge edge, String from, String to, int order) {
        return StructuralEdge.builder()
                .id(edge.getEdgeId())
                .from(from)
                .to(to)
                .type(edge.getRelationType())
                .label(edge.getLabel())
                .order(order)
                .build();
    }
}
