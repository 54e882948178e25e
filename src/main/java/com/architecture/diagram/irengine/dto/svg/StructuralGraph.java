package com.architecture.diagram.irengine.dto.svg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed graph extracted from an SVG document. Built fresh for every parse and never
 * mutated afterwards. Node and edge lists follow document order.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StructuralGraph {

    String svgId;
    String diagramType;
    double width;
    double height;
    String viewbox;
    List<SvgNode> nodes;
    List<SvgEdge> edges;
    List<SvgGroup> groups;
    List<String> duplicateIds;
    String irMetadata;

    @JsonIgnore
    Map<String, StructuralElement> elementIndex;

    public Optional<StructuralElement> find(String id) {
        return Optional.ofNullable(elementIndex.get(id));
    }

    @JsonIgnore
    public Set<String> getNodeIds() {
        Set<String> ids = new LinkedHashSet<>();
        nodes.forEach(n -> ids.add(n.getId()));
        return ids;
    }

    @JsonIgnore
    public Set<String> getEdgeIds() {
        Set<String> ids = new LinkedHashSet<>();
        edges.forEach(e -> ids.add(e.getId()));
        return ids;
    }

    @JsonIgnore
    public Set<String> getGroupIds() {
        Set<String> ids = new LinkedHashSet<>();
        groups.forEach(g -> ids.add(g.getId()));
        return ids;
    }

    public Map<String, Integer> stats() {
        return Map.of(
                "nodes", nodes.size(),
                "edges", edges.size(),
                "groups", groups.size());
    }
}
