package com.architecture.diagram.irengine.dto.codec;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StructuralGroup {
    String id;
    String label;
    List<String> members;
}
