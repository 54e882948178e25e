package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import lombok.Value;

/**
 * Hides or shows a block. Edges stay in the IR; renderers skip edges touching hidden blocks.
 */
@Value
public class VisibilityPatch implements BlockPatch {

    String blockId;
    boolean hidden;

    @Override
    public FeedbackAction getAction() {
        return hidden ? FeedbackAction.HIDE : FeedbackAction.SHOW;
    }

    @Override
    public PatchLogEntry apply(Diagram diagram) {
        Block block = BlockPatch.requireBlock(diagram, blockId);
        boolean before = block.hidden();
        block.setHidden(hidden);
        BlockPatch.bumpVersion(block);
        return PatchLogEntry.builder().op(getAction()).blockId(blockId).before(before).after(hidden).build();
    }
}
