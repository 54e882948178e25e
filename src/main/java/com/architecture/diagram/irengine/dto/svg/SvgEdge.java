package com.architecture.diagram.irengine.dto.svg;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Edge extracted from SVG. Endpoints may be null when they cannot be resolved;
 * such edges are kept and reported, never dropped.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SvgEdge implements StructuralElement {

    String id;
    String groupId;
    String elementType;
    String selector;
    String sourceId;
    String targetId;
    String edgeType;
    String animatableSelector;
    String label;
    Bounds bounds;
    List<Point> points;
    EndpointResolution endpointResolution;
    double endpointConfidence;
    Map<String, String> attributes;

    public boolean isFullyResolved() {
        return sourceId != null && targetId != null;
    }
}
