package com.architecture.diagram.irengine.dto.codec;

import com.architecture.diagram.irengine.dto.enrich.Layout;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Renderer-neutral model every codec encodes from.
 */
@Value
@Builder(toBuilder = true)
public class StructuralIr {

    @Builder.Default
    String diagramKind = "architecture";
    @Builder.Default
    Layout layout = Layout.TOP_DOWN;
    String title;
    @Builder.Default
    List<StructuralNode> nodes = List.of();
    @Builder.Default
    List<StructuralEdge> edges = List.of();
    @Builder.Default
    List<StructuralGroup> groups = List.of();

    // Edges whose endpoints could not be resolved; emitted as comments, never as relationships
    @Builder.Default
    List<StructuralEdge> unresolved = List.of();

    public boolean isSequence() {
        return "sequence".equalsIgnoreCase(diagramKind);
    }

    /**
     * Copy with nodes and groups sorted by id and edges by (from, to, type, label, order).
     */
    public StructuralIr normalized() {
        List<StructuralNode> sortedNodes = new ArrayList<>(nodes);
        sortedNodes.sort(Comparator.comparing(StructuralNode::getId));

        Comparator<StructuralEdge> edgeOrder = Comparator
                .comparing((StructuralEdge e) -> Objects.toString(e.getFrom(), ""))
                .thenComparing(e -> Objects.toString(e.getTo(), ""))
                .thenComparing(e -> Objects.toString(e.getType(), ""))
                .thenComparing(e -> Objects.toString(e.getLabel(), ""))
                .thenComparing(e -> e.getOrder() != null ? e.getOrder() : 0)
                .thenComparing(e -> Objects.toString(e.getId(), ""));
        List<StructuralEdge> sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(edgeOrder);
        List<StructuralEdge> sortedUnresolved = new ArrayList<>(unresolved);
        sortedUnresolved.sort(Comparator.comparing(e -> Objects.toString(e.getId(), "")));

        List<StructuralGroup> sortedGroups = new ArrayList<>();
        groups.stream()
                .sorted(Comparator.comparing(StructuralGroup::getId))
                .forEach(g -> sortedGroups.add(StructuralGroup.builder()
                        .id(g.getId())
                        .label(g.getLabel())
                        .members(g.getMembers() == null ? List.of() : g.getMembers().stream().sorted().toList())
                        .build()));

        return toBuilder()
                .nodes(sortedNodes)
                .edges(sortedEdges)
                .groups(sortedGroups)
                .unresolved(sortedUnresolved)
                .build();
    }
}
