package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.ir.IrEdge;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deletes a block together with every edge that references it.
 */
@Value
public class RemoveBlockPatch implements BlockPatch {

    String blockId;

    @Override
    public FeedbackAction getAction() {
        return FeedbackAction.REMOVE_BLOCK;
    }

    @Override
    public PatchLogEntry apply(Diagram diagram) {
        Block block = BlockPatch.requireBlock(diagram, blockId);
        List<String> removedEdges = diagram.getEdges().stream()
                .filter(e -> e.touches(blockId))
                .map(IrEdge::getEdgeId)
                .collect(Collectors.toList());

        diagram.getBlocks().removeIf(b -> blockId.equals(b.getId()));
        diagram.getEdges().removeIf(e -> e.touches(blockId));

        Map<String, Object> before = new LinkedHashMap<>();
        before.put("text", block.getText());
        before.put("removed_edges", removedEdges);
        return PatchLogEntry.builder().op(getAction()).blockId(blockId).before(before).build();
    }
}
