package com.architecture.diagram.irengine.dto.plan;

import com.architecture.diagram.irengine.exception.SchemaValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal architecture description handed to the enricher, usually produced by an LLM.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ArchitecturePlan {

    private String systemName;
    private String diagramType;
    private List<String> diagramViews;
    private VisualHints visualHints;

    // zone name -> labels, e.g. {"clients": ["Browser"]}
    private Map<String, List<String>> zones;

    @Builder.Default
    private List<PlanRelationship> relationships = new ArrayList<>();

    private AestheticIntent aestheticIntent;

    /**
     * Zones keyed by their enum, with unknown zone names rejected.
     *
     * @throws SchemaValidationException naming the first unknown zone
     */
    public Map<Zone, List<String>> zoneLabels() {
        Map<Zone, List<String>> typed = new EnumMap<>(Zone.class);
        if (zones == null) {
            return typed;
        }
        for (Map.Entry<String, List<String>> entry : zones.entrySet()) {
            Zone zone = Zone.fromString(entry.getKey());
            if (zone == null) {
                throw new SchemaValidationException("/zones/" + entry.getKey(), "unknown zone", null);
            }
            List<String> labels = typed.computeIfAbsent(zone, z -> new ArrayList<>());
            if (entry.getValue() != null) {
                labels.addAll(entry.getValue());
            }
        }
        return typed;
    }
}
