package com.architecture.diagram.irengine.dto.codec;

import lombok.Builder;
import lombok.Value;

/**
 * Renderer-neutral relationship. {@code from} or {@code to} is null when the source SVG never
 * tied the edge to a node.
 */
@Value
@Builder
public class StructuralEdge {
    String id;
    String from;
    String to;
    String type;
    String label;
    Integer order;  // message order for sequence diagrams

    public boolean isResolved() {
        return from != null && to != null;
    }
}
