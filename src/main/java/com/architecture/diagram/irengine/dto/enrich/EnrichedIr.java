package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Fully styled, connected diagram produced from an architecture plan.
 * Ordering of every list is deterministic for a given plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnrichedIr {
    private String systemName;
    private String diagramType;
    private Layout layout;
    private List<String> zoneOrder;
    private List<EnrichedNode> nodes;
    private List<EnrichedEdge> edges;
    private List<InferenceRecord> inferences;
    private GlobalIntent globalIntent;
    private EnrichmentMetadata metadata;
}
