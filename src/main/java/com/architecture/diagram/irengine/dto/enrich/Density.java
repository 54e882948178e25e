package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Density {
    COMPACT("compact"),
    BALANCED("balanced"),
    SPACIOUS("spacious");

    private final String value;

    Density(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns null for unrecognised values so callers can apply their own default.
     */
    public static Density fromString(String value) {
        if (value == null) return null;
        for (Density candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
