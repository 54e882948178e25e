package com.architecture.diagram.irengine.service.patch;

import com.architecture.diagram.irengine.dto.ir.BoundingBox;
import com.architecture.diagram.irengine.dto.patch.FeedbackAction;
import com.architecture.diagram.irengine.dto.patch.FeedbackRequest;
import com.architecture.diagram.irengine.exception.PatchValidationException;
import com.architecture.diagram.irengine.exception.UnsupportedActionException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a loosely typed feedback request into a {@link BlockPatch}.
 */
@Component
public class FeedbackParser {

    public BlockPatch parse(FeedbackRequest request) {
        FeedbackAction action = FeedbackAction.fromString(request.getAction());
        if (action == null) {
            throw new UnsupportedActionException(request.getAction());
        }
        String blockId = request.getBlockId();
        if (action.requiresBlockId() && (blockId == null || blockId.isBlank())) {
            throw new PatchValidationException("block_id required for " + action.getValue());
        }
        Map<String, Object> payload = request.getPayload() != null ? request.getPayload() : Map.of();

        switch (action) {
            case EDIT_TEXT:
                return new EditTextPatch(blockId, text(payload.get("text"), ""));
            case REPOSITION:
                Map<String, Object> bbox = map(payload.get("bbox"), "bbox");
                return new RepositionPatch(blockId,
                        number(bbox.get("x"), "bbox.x"), number(bbox.get("y"), "bbox.y"),
                        number(bbox.get("w"), "bbox.w"), number(bbox.get("h"), "bbox.h"));
            case STYLE:
                return new StylePatch(blockId, map(payload.get("style"), "style"));
            case ANNOTATE:
                return new AnnotatePatch(blockId, map(payload.get("annotations"), "annotations"));
            case HIDE:
                return new VisibilityPatch(blockId, true);
            case SHOW:
                return new VisibilityPatch(blockId, false);
            case ADD_BLOCK:
                return parseAddBlock(payload);
            case REMOVE_BLOCK:
                return new RemoveBlockPatch(blockId);
            default:
                throw new UnsupportedActionException(request.getAction());
        }
    }

    private AddBlockPatch parseAddBlock(Map<String, Object> payload) {
        AddBlockPatch.AddBlockPatchBuilder builder = AddBlockPatch.builder()
                .id(blankToNull(text(payload.get("id"), null)))
                .type(text(payload.get("type"), AddBlockPatch.DEFAULT_TYPE))
                .text(text(payload.get("text"), AddBlockPatch.DEFAULT_TEXT))
                .style(map(payload.get("style"), "style"))
                .annotations(map(payload.get("annotations"), "annotations"))
                .zone(blankToNull(text(payload.get("zone"), null)));
        if (payload.get("bbox") != null) {
            Map<String, Object> bbox = map(payload.get("bbox"), "bbox");
            builder.bbox(new BoundingBox(
                    orZero(number(bbox.get("x"), "bbox.x")), orZero(number(bbox.get("y"), "bbox.y")),
                    orDefault(number(bbox.get("w"), "bbox.w"), 120), orDefault(number(bbox.get("h"), "bbox.h"), 40)));
        }
        return builder.build();
    }

    // ========================= PAYLOAD COERCION =========================

    private static String text(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        return String.valueOf(value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value, String field) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new PatchValidationException(field + " must be an object");
        }
        return new LinkedHashMap<>((Map<String, Object>) value);
    }

    private static Double number(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new PatchValidationException(field + " must be a number, got '" + value + "'", e);
        }
    }

    private static double orZero(Double value) {
        return value != null ? value : 0;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
