package com.architecture.diagram.irengine.dto.enrich;

import com.architecture.diagram.irengine.dto.ir.EdgeCategory;
import com.architecture.diagram.irengine.dto.ir.EdgeMode;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Relationship types understood by the enricher, each with its line preset and IR edge semantics.
 */
public enum RelationType {
    SYNC("sync", new EdgeStyle("solid", "normal", 0.0, -1), EdgeCategory.CONTROL, EdgeMode.SYNC),
    ASYNC("async", new EdgeStyle("dashed", "open", 0.0, 1), EdgeCategory.DATA_FLOW, EdgeMode.ASYNC),
    DATA("data", new EdgeStyle("dashed", "open", 0.1, 3), EdgeCategory.DATA_FLOW, EdgeMode.SYNC),
    AUTH("auth", new EdgeStyle("solid", "normal", 0.0, 2), EdgeCategory.AUTH, EdgeMode.SYNC);

    private final String value;
    private final EdgeStyle preset;
    private final EdgeCategory category;
    private final EdgeMode mode;

    RelationType(String value, EdgeStyle preset, EdgeCategory category, EdgeMode mode) {
        this.value = value;
        this.preset = preset;
        this.category = category;
        this.mode = mode;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public EdgeStyle getPreset() {
        return preset;
    }

    public EdgeCategory getCategory() {
        return category;
    }

    public EdgeMode getMode() {
        return mode;
    }

    /**
     * Resolve the preset colour against a palette; negative indexes count from the end.
     */
    public String colorFrom(List<String> palette) {
        int size = palette.size();
        return palette.get(Math.floorMod(preset.getPaletteIndex(), size));
    }

    public static RelationType fromString(String value) {
        if (value == null) return null;
        for (RelationType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
