package com.architecture.diagram.irengine.dto.plan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Architectural role of a node, derived from its zone or inferred from its label.
 */
public enum NodeRole {
    ACTOR("actor", "person"),
    GATEWAY("gateway", "ingress"),
    SERVICE("service", "api"),
    EXTERNAL("external", "integration"),
    DATA_STORE("data_store", "database");

    private final String value;
    private final String stereotype;

    NodeRole(String value, String stereotype) {
        this.value = value;
        this.stereotype = stereotype;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getStereotype() {
        return stereotype;
    }
}
