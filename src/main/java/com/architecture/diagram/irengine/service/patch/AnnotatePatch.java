package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import lombok.Value;

import java.util.Map;
import java.util.TreeMap;

@Value
public class AnnotatePatch implements BlockPatch {

    String blockId;
    Map<String, Object> annotations;

    @Override
    public FeedbackAction getAction() {
        return FeedbackAction.ANNOTATE;
    }

    @Override
    public PatchLogEntry apply(Diagram diagram) {
        Block block = BlockPatch.requireBlock(diagram, blockId);
        Map<String, Object> before = new TreeMap<>(block.getAnnotations() != null ? block.getAnnotations() : Map.of());
        Map<String, Object> after = new TreeMap<>(before);
        after.putAll(annotations);
        block.setAnnotations(after);
        BlockPatch.bumpVersion(block);
        return PatchLogEntry.builder().op(getAction()).blockId(blockId).before(before).after(new TreeMap<>(after)).build();
    }
}
