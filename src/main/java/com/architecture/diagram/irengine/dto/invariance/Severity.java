package com.architecture.diagram.irengine.dto.invariance;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
