package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Delivery mode of an IR edge.
 */
public enum EdgeMode {
    SYNC("sync"),
    ASYNC("async"),
    BROADCAST("broadcast"),
    CONDITIONAL("conditional");

    private final String value;

    EdgeMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(EdgeMode::getValue).toList();
    }

    /**
     * Get the enum constant for a wire value, case-insensitive. Returns null when unknown.
     */
    @JsonCreator
    public static EdgeMode fromString(String value) {
        if (value == null) return null;
        for (EdgeMode candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
