package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Mood {
    MINIMAL("minimal"),
    VIBRANT("vibrant"),
    FORMAL("formal"),
    PLAYFUL("playful");

    private final String value;

    Mood(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns null for unrecognised values so callers can apply their own default.
     */
    public static Mood fromString(String value) {
        if (value == null) return null;
        for (Mood candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
