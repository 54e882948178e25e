package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.BoundingBox;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import lombok.Value;

/**
 * Moves or resizes a block. Null coordinates keep their current value.
 */
@Value
public class RepositionPatch implements BlockPatch {

    String blockId;
    Double x;
    Double y;
    Double w;
    Double h;

    @Override
    public FeedbackAction getAction() {
        return FeedbackAction.REPOSITION;
    }

    @Override
    public PatchLogEntry apply(Diagram diagram) {
        Block block = BlockPatch.requireBlock(diagram, blockId);
        BoundingBox current = block.getBbox() != null ? block.getBbox() : new BoundingBox(0, 0, 0, 0);
        BoundingBox moved = new BoundingBox(
                x != null ? x : current.getX(),
                y != null ? y : current.getY(),
                w != null ? w : current.getW(),
                h != null ? h : current.getH());
        if (moved.getW() < 0 || moved.getH() < 0) {
            throw new PatchValidationException("bbox width and height must be non-negative for block " + blockId);
        }
        block.setBbox(moved);
        BlockPatch.bumpVersion(block);
        return PatchLogEntry.builder().op(getAction()).blockId(blockId).before(current).after(moved).build();
    }
}
