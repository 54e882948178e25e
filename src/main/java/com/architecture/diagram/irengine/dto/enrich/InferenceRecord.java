package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Audit entry for one inferred edge. Created during enrichment and never modified.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InferenceRecord {
    String edgeId;
    String fromId;
    String toId;
    InferenceRule rule;
    String reason;
    double confidence;
}
