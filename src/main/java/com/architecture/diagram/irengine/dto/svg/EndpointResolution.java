package com.architecture.diagram.irengine.dto.svg;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an edge's endpoints were determined. Only the first two are exact.
 */
public enum EndpointResolution {
    EXPLICIT_ATTRIBUTE(1.0),
    ID_SUBSTRING(1.0),
    GEOMETRIC(0.6),
    UNRESOLVED(0.0);

    private final double confidence;

    EndpointResolution(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }

    public boolean isExact() {
        return this == EXPLICIT_ATTRIBUTE || this == ID_SUBSTRING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
