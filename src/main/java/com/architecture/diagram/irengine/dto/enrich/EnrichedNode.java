package com.architecture.diagram.irengine.dto.enrich;

import com.architecture.diagram.irengine.dto.plan.NodeRole;
import com.architecture.diagram.irengine.dto.plan.Zone;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnrichedNode {

    private String nodeId;
    private String label;
    private NodeRole role;
    private Zone zone;          // null for nodes inferred from relationships
    private NodeKind type;
    private String stereotype;
    private String shape;
    private String sizeHint;
    private NodeStyle nodeStyle;
    private RenderingHints renderingHints;
    private NodeProvenance metadata;
}
