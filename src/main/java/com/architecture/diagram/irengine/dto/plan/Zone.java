package com.architecture.diagram.irengine.dto.plan;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Architecture zones a plan may place labels in, in default rendering order.
 */
public enum Zone {
    CLIENTS("clients", NodeRole.ACTOR),
    EDGE("edge", NodeRole.GATEWAY),
    CORE_SERVICES("core_services", NodeRole.SERVICE),
    EXTERNAL_SERVICES("external_services", NodeRole.EXTERNAL),
    DATA_STORES("data_stores", NodeRole.DATA_STORE);

    private final String value;
    private final NodeRole role;

    Zone(String value, NodeRole role) {
        this.value = value;
        this.role = role;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public NodeRole getRole() {
        return role;
    }

    public static Zone fromString(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (Zone zone : values()) {
            if (zone.value.equals(normalized)) {
                return zone;
            }
        }
        return null;
    }
}
