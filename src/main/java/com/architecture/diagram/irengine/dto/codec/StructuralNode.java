package com.architecture.diagram.irengine.dto.codec;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StructuralNode {
    String id;
    String kind;    // actor, container, data_store, external, component, ...
    String label;
    String group;   // owning group id, or null
}
