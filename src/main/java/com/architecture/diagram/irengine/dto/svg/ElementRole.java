package com.architecture.diagram.irengine.dto.svg;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic role of a structural node extracted from SVG.
 */
public enum ElementRole {
    NODE,
    BOUNDARY,
    LABEL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
