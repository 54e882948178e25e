package com.architecture.diagram.irengine.dto.svg;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SvgGroup implements StructuralElement {

    String id;
    String elementType;
    String selector;
    String label;
    Bounds bounds;
    List<String> memberIds;
}
