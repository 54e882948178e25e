package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A styled edge. {@code confidence} and {@code reason} are always set so every edge can be
 * explained; inferred edges carry a lower opacity and a dashed line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnrichedEdge {

    private String edgeId;
    private String fromId;
    private String toId;
    private RelationType relType;
    private String label;
    private String style;
    private String color;
    private int width;
    private String arrowhead;
    private TextStyle textStyle;
    private double curvature;
    private double opacity;
    private double confidence;
    private String reason;
    private boolean inferred;
}
