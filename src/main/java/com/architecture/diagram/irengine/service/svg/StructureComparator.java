package com.architecture.diagram.irengine.service.svg;

import com.architecture.diagram.irengine.dto.invariance.Severity;
import com.architecture.diagram.irengine.dto.svg.StructuralElement;
import com.architecture.diagram.irengine.dto.svg.StructuralGraph;
import com.architecture.diagram.irengine.dto.svg.StructureComparison;
import com.architecture.diagram.irengine.dto.svg.StructureDifference;
import com.architecture.diagram.irengine.dto.svg.StructureDifference.DifferenceType;
import com.architecture.diagram.irengine.dto.svg.SvgEdge;
import com.architecture.diagram.irengine.dto.svg.SvgNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Compares two structural graphs by element id. Ordering of nodes and edges never matters.
 */
@Service
@Slf4j
public class StructureComparator {

    public StructureComparison compare(StructuralGraph original, StructuralGraph modified) {
        List<StructureDifference> differences = new ArrayList<>();

        Map<String, SvgNode> originalNodes = indexById(original.getNodes());
        Map<String, SvgNode> modifiedNodes = indexById(modified.getNodes());
        Map<String, SvgEdge> originalEdges = indexById(original.getEdges());
        Map<String, SvgEdge> modifiedEdges = indexById(modified.getEdges());

        diffMaps(originalNodes, modifiedNodes, DifferenceType.NODES_ADDED, DifferenceType.NODES_REMOVED, differences);
        diffMaps(originalEdges, modifiedEdges, DifferenceType.EDGES_ADDED, DifferenceType.EDGES_REMOVED, differences);

        // ========================= RECONNECTION =========================
        for (String edgeId : new TreeSet<>(modifiedEdges.keySet())) {
            SvgEdge before = originalEdges.get(edgeId);
            if (before == null) {
                continue;
            }
            SvgEdge after = modifiedEdges.get(edgeId);
            if (!Objects.equals(before.getSourceId(), after.getSourceId())
                    || !Objects.equals(before.getTargetId(), after.getTargetId())) {
                differences.add(StructureDifference.builder()
                        .type(DifferenceType.EDGE_RECONNECTED)
                        .severity(Severity.ERROR)
                        .elementIds(List.of(edgeId))
                        .before(endpoints(before))
                        .after(endpoints(after))
                        .build());
            }
        }

        // ========================= GROUP MEMBERSHIP =========================
        for (String nodeId : new TreeSet<>(modifiedNodes.keySet())) {
            SvgNode before = originalNodes.get(nodeId);
            if (before == null) {
                continue;
            }
            SvgNode after = modifiedNodes.get(nodeId);
            if (!Objects.equals(before.getParentId(), after.getParentId())) {
                differences.add(StructureDifference.builder()
                        .type(DifferenceType.GROUP_MEMBERSHIP_CHANGED)
                        .severity(Severity.WARNING)
                        .elementIds(List.of(nodeId))
                        .before(before.getParentId())
                        .after(after.getParentId())
                        .build());
            }
        }

        boolean equivalent = differences.stream().noneMatch(d -> d.getSeverity() == Severity.ERROR);
        log.debug("Compared {} vs {}: {} differences, equivalent={}",
                original.getSvgId(), modified.getSvgId(), differences.size(), equivalent);

        return StructureComparison.builder()
                .equivalent(equivalent)
                .differences(differences)
                .originalStats(original.stats())
                .modifiedStats(modified.stats())
                .build();
    }

    private <T extends StructuralElement> void diffMaps(Map<String, T> originalMap, Map<String, T> modifiedMap,
                                                        DifferenceType addedType, DifferenceType removedType,
                                                        List<StructureDifference> out) {
        // Added: in modified but not in original
        List<String> added = new ArrayList<>(new TreeSet<>(modifiedMap.keySet()));
        added.removeAll(originalMap.keySet());
        if (!added.isEmpty()) {
            out.add(StructureDifference.builder()
                    .type(addedType)
                    .severity(Severity.ERROR)
                    .elementIds(added)
                    .build());
        }

        // Removed: in original but not in modified
        List<String> removed = new ArrayList<>(new TreeSet<>(originalMap.keySet()));
        removed.removeAll(modifiedMap.keySet());
        if (!removed.isEmpty()) {
            out.add(StructureDifference.builder()
                    .type(removedType)
                    .severity(Severity.ERROR)
                    .elementIds(removed)
                    .build());
        }
    }

    private static <T extends StructuralElement> Map<String, T> indexById(List<T> elements) {
        Map<String, T> map = new LinkedHashMap<>();
        elements.forEach(e -> map.putIfAbsent(e.getId(), e));
        return map;
    }

    private static String endpoints(SvgEdge edge) {
        return edge.getSourceId() + "->" + edge.getTargetId();
    }
}
