package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connectivity rules, strongest first.
 */
public enum InferenceRule {
    TECH_DEPENDENCY("tech_dependency", 0.7),
    ZONE_CASCADE("zone_cascade", 0.5),
    COMPLETION_GUARD("completion_guard", 0.3);

    private final String value;
    private final double confidence;

    InferenceRule(String value, double confidence) {
        this.value = value;
        this.confidence = confidence;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getConfidence() {
        return confidence;
    }
}
