package com.architecture.diagram.irengine.dto.svg;

import com.architecture.diagram.irengine.dto.invariance.Severity;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A single structural difference between two SVG graphs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructureDifference {

    public enum DifferenceType {
        NODES_ADDED,
        NODES_REMOVED,
        EDGES_ADDED,
        EDGES_REMOVED,
        EDGE_RECONNECTED,
        GROUP_MEMBERSHIP_CHANGED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    private DifferenceType type;
    private Severity severity;
    private List<String> elementIds;

    // For EDGE_RECONNECTED / GROUP_MEMBERSHIP_CHANGED: before and after
    private String before;
    private String after;
}
