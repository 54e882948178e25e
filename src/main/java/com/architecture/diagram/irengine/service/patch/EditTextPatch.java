package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import lombok.Value;

@Value
public class EditTextPatch implements BlockPatch {

    String blockId;
    String text;

    @Override
    public FeedbackAction getAction() {
        return FeedbackAction.EDIT_TEXT;
    }

    @Override
    public PatchLogEntry apply(Diagram diagram) {
        Block block = BlockPatch.requireBlock(diagram, blockId);
        String before = block.getText();
        block.setText(text);
        BlockPatch.bumpVersion(block);
        return PatchLogEntry.builder().op(getAction()).blockId(blockId).before(before).after(text).build();
    }
}
