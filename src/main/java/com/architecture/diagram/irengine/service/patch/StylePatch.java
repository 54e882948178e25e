package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import lombok.Value;

import java.util.Map;
import java.util.TreeMap;

/**
 * Merges style keys into a block; existing keys not mentioned are kept.
 */
@Value
public class StylePatch implements BlockPatch {

    String blockId;
    Map<String, Object> style;

    @Override
    public FeedbackAction getAction() {
        return FeedbackAction.STYLE;
    }

    @Override
    public PatchLogEntry apply(Diagram diagram) {
        Block block = BlockPatch.requireBlock(diagram, blockId);
        Map<String, Object> before = new TreeMap<>(block.getStyle() != null ? block.getStyle() : Map.of());
        Map<String, Object> after = new TreeMap<>(before);
        after.putAll(style);
        block.setStyle(after);
        BlockPatch.bumpVersion(block);
        return PatchLogEntry.builder().op(getAction()).blockId(blockId).before(before).after(new TreeMap<>(after)).build();
    }
}
