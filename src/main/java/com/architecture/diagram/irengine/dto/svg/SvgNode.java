package com.architecture.diagram.irengine.dto.svg;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SvgNode implements StructuralElement {

    String id;
    String elementType;     // g, rect, circle, ellipse, polygon, label
    String selector;
    String label;
    Point center;
    Bounds bounds;
    ElementRole role;
    String zone;
    String animatableSelector;
    String textSelector;
    String parentId;
    Map<String, String> attributes;
}
