package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Traffic category of an IR edge.
 */
public enum EdgeCategory {
    DATA_FLOW("data_flow"),
    USER_TRAFFIC("user_traffic"),
    REPLICATION("replication"),
    AUTH("auth"),
    SECRET_DISTRIBUTION("secret_distribution"),
    MONITORING("monitoring"),
    CONTROL("control"),
    METADATA("metadata"),
    NETWORK("network");

    private final String value;

    EdgeCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(EdgeCategory::getValue).toList();
    }

    /**
     * Get the enum constant for a wire value, case-insensitive. Returns null when unknown.
     */
    @JsonCreator
    public static EdgeCategory fromString(String value) {
        if (value == null) return null;
        for (EdgeCategory candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
