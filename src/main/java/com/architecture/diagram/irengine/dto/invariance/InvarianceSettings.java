package com.architecture.diagram.irengine.dto.invariance;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InvarianceSettings {

    @Builder.Default
    InvariancePolicy policy = InvariancePolicy.LOG_AND_CONTINUE;

    @Builder.Default
    boolean strict = true;
}
