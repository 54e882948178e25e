package com.architecture.diagram.irengine.dto.patch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Audit entry for one applied patch: {@code {op, block_id, before?, after?}}.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchLogEntry {
    FeedbackAction op;
    String blockId;
    Object before;
    Object after;
}
