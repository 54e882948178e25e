package com.architecture.diagram.irengine.dto.invariance;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationType {
    NODE_MISSING,
    NODE_ADDED,
    EDGE_MISSING,
    EDGE_ADDED,
    GROUP_MISSING,
    GROUP_ADDED,
    LABEL_CHANGED,
    STRUCTURE_CHANGED,
    ID_COLLISION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
