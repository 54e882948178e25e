package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Normalised layout directions.
 */
public enum Layout {
    LEFT_RIGHT("left-right"),
    RIGHT_LEFT("right-left"),
    TOP_DOWN("top-down"),
    BOTTOM_UP("bottom-up"),
    GRID("grid");

    private static final Map<String, Layout> ALIASES = Map.of(
            "left-to-right", LEFT_RIGHT,
            "left_right", LEFT_RIGHT,
            "lr", LEFT_RIGHT,
            "right-to-left", RIGHT_LEFT,
            "right_left", RIGHT_LEFT,
            "top_down", TOP_DOWN,
            "top-to-bottom", TOP_DOWN,
            "tb", TOP_DOWN,
            "bottom_up", BOTTOM_UP
    );

    private final String value;

    Layout(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isHorizontal() {
        return this == LEFT_RIGHT || this == RIGHT_LEFT;
    }

    /**
     * Normalise a free-form hint; anything unrecognised becomes {@link #TOP_DOWN}.
     */
    public static Layout normalize(String hint) {
        if (hint == null || hint.isBlank()) return TOP_DOWN;
        String key = hint.trim().toLowerCase().replace(' ', '-');
        for (Layout layout : values()) {
            if (layout.value.equals(key)) {
                return layout;
            }
        }
        return ALIASES.getOrDefault(key, TOP_DOWN);
    }
}
