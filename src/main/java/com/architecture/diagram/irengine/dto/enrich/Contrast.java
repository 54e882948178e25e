package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Contrast {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high");

    private final String value;

    Contrast(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns null for unrecognised values so callers can apply their own default.
     */
    public static Contrast fromString(String value) {
        if (value == null) return null;
        for (Contrast candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
