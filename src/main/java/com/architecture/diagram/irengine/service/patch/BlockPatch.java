package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import com.architecture.diagram.irengine.exception.BlockNotFoundException;

/**
 * A typed edit applied in place to a working copy of a diagram.
 */
public interface BlockPatch {

    FeedbackAction getAction();

    /**
     * Target block, or null for patches that create one.
     */
    String getBlockId();

    PatchLogEntry apply(Diagram diagram);

    static Block requireBlock(Diagram diagram, String blockId) {
        return diagram.findBlock(blockId).orElseThrow(() -> new BlockNotFoundException(blockId));
    }

    static void bumpVersion(Block block) {
        block.setVersion(block.getVersion() + 1);
    }
}
