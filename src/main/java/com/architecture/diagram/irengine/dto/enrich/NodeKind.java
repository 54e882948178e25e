package com.architecture.diagram.irengine.dto.enrich;

import com.architecture.diagram.irengine.dto.plan.NodeRole;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rendering kind of an enriched node with its fixed shape, size and renderer tokens.
 */
public enum NodeKind {
    ACTOR("actor", "circular", "small", "actor", "actor", 6),
    CONTAINER("container", "rounded", "medium", "component", "class", 8),
    COMPONENT("component", "rectangle", "medium", "component", "class", 8),
    DATA_STORE("data_store", "cylinder", "medium", "database", "entity", 10),
    EXTERNAL("external", "cloud", "medium", "cloud", "subgraph", 8),
    SYSTEM("system", "rectangle", "large", "component", "class", 8);

    private final String value;
    private final String shape;
    private final String sizeHint;
    private final String plantUmlShape;
    private final String mermaidType;
    private final int padding;

    NodeKind(String value, String shape, String sizeHint, String plantUmlShape, String mermaidType, int padding) {
        this.value = value;
        this.shape = shape;
        this.sizeHint = sizeHint;
        this.plantUmlShape = plantUmlShape;
        this.mermaidType = mermaidType;
        this.padding = padding;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getShape() {
        return shape;
    }

    public String getSizeHint() {
        return sizeHint;
    }

    public String getPlantUmlShape() {
        return plantUmlShape;
    }

    public String getMermaidType() {
        return mermaidType;
    }

    public int getPadding() {
        return padding;
    }

    public static NodeKind forRole(NodeRole role) {
        switch (role) {
            case ACTOR:
                return ACTOR;
            case EXTERNAL:
                return EXTERNAL;
            case DATA_STORE:
                return DATA_STORE;
            default:
                return CONTAINER;
        }
    }

    public static NodeKind fromString(String value) {
        if (value == null) return null;
        for (NodeKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        return null;
    }
}
