package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

public enum EdgeDirection {
    UNIDIRECTIONAL("unidirectional"),
    BIDIRECTIONAL("bidirectional");

    private final String value;

    EdgeDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(EdgeDirection::getValue).toList();
    }

    /**
     * Get the enum constant for a wire value, case-insensitive. Returns null when unknown.
     */
    @JsonCreator
    public static EdgeDirection fromString(String value) {
        if (value == null) return null;
        for (EdgeDirection candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
