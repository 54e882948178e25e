package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.Block;
import com.architecture.diagram.irengine.dto.ir.BoundingBox;
import com.architecture.diagram.irengine.dto.ir.Diagram;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.PatchLogEntry;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import lombok.Builder;
import lombok.Value;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Appends a new block. Without an explicit id the first free {@code block-N} is used.
 */
@Value
@Builder
public class AddBlockPatch implements BlockPatch {

    public static final String DEFAULT_TYPE = "component";
    public static final String DEFAULT_TEXT = "New Block";

    String id;
    @Builder.Default
    String type = DEFAULT_TYPE;
    @Builder.Default
    String text = DEFAULT_TEXT;
    @Builder.Default
    BoundingBox bbox = new BoundingBox(0, 0, 120, 40);
    @Builder.Default
    Map<String, Object> style = Map.of();
    @Builder.Default
    Map<String, Object> annotations = Map.of();
    String zone;

    @Override
    public FeedbackAction getAction() {
        return FeedbackAction.ADD_BLOCK;
    }

    @Override
    public String getBlockId() {
        return id;
    }

    @Override
    public PatchLogEntry apply(Diagram diagram) {
        Set<String> taken = new HashSet<>(diagram.getBlockIds());
        String blockId = id != null ? id : nextFreeId(taken, diagram.getBlocks().size() + 1);
        if (taken.contains(blockId)) {
            throw new PatchValidationException("block_id '" + blockId + "' already exists");
        }
        if (bbox.getW() < 0 || bbox.getH() < 0) {
            throw new PatchValidationException("bbox width and height must be non-negative for block " + blockId);
        }
        Block block = Block.builder()
                .id(blockId)
                .type(type)
                .text(text)
                .bbox(new BoundingBox(bbox.getX(), bbox.getY(), bbox.getW(), bbox.getH()))
                .style(new TreeMap<>(style))
                .annotations(new TreeMap<>(annotations))
                .zone(zone)
                .build();
        diagram.getBlocks().add(block);
        return PatchLogEntry.builder().op(getAction()).blockId(blockId).after(text).build();
    }

    private static String nextFreeId(Set<String> taken, int start) {
        int n = start;
        while (taken.contains("block-" + n)) {
            n++;
        }
        return "block-" + n;
    }
}
