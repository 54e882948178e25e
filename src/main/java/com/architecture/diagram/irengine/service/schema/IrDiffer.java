package com.architecture.diagram.irengine.service.schema;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.DiffSummary;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes the block/edge diff between two diagrams.
 */
@Component
public class IrDiffer {

    public DiffSummary diff(Diagram before, Diagram after) {
        Map<String, Block> beforeBlocks = index(before.getBlocks(), Block::getId);
        Map<String, Block> afterBlocks = index(after.getBlocks(), Block::getId);
        Map<String, IrEdge> beforeEdges = index(before.getEdges(), IrEdge::getEdgeId);
        Map<String, IrEdge> afterEdges = index(after.getEdges(), IrEdge::getEdgeId);

        List<String> blocksModified = new ArrayList<>();
        for (Map.Entry<String, Block> entry : afterBlocks.entrySet()) {
            Block previous = beforeBlocks.get(entry.getKey());
            if (previous != null && !Objects.equals(previous, entry.getValue())) {
                blocksModified.add(entry.getKey());
            }
        }

        return DiffSummary.builder()
                .blocksBefore(before.getBlocks().size())
                .blocksAfter(after.getBlocks().size())
                .edgesBefore(before.getEdges().size())
                .edgesAfter(after.getEdges().size())
                .blocksAdded(keysOnlyIn(afterBlocks, beforeBlocks))
                .blocksRemoved(keysOnlyIn(beforeBlocks, afterBlocks))
                .blocksModified(blocksModified)
                .edgesAdded(keysOnlyIn(afterEdges, beforeEdges))
                .edgesRemoved(keysOnlyIn(beforeEdges, afterEdges))
                .description(String.format("blocks=%d->%d; edges=%d->%d",
                        before.getBlocks().size(), after.getBlocks().size(),
                        before.getEdges().size(), after.getEdges().size()))
                .build();
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> key) {
        Map<String, T> map = new LinkedHashMap<>();
        items.forEach(item -> map.putIfAbsent(key.apply(item), item));
        return map;
    }

    private static List<String> keysOnlyIn(Map<String, ?> left, Map<String, ?> right) {
        List<String> keys = new ArrayList<>();
        for (String key : left.keySet()) {
            if (!right.containsKey(key)) {
                keys.add(key);
            }
        }
        return keys;
    }
}
