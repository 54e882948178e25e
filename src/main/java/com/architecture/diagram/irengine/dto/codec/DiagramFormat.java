package com.architecture.diagram.irengine.dto.codec;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiagramFormat {
    PLANTUML("plantuml"),
    MERMAID("mermaid"),
    STRUCTURIZR("structurizr"),
    SVG("svg");

    private final String value;

    DiagramFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static DiagramFormat fromString(String value) {
        if (value == null) return null;
        for (DiagramFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        return null;
    }
}
