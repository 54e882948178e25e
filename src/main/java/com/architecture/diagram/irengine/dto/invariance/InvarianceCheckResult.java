package com.architecture.diagram.irengine.dto.invariance;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a single pre/post invariance check. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InvarianceCheckResult {

    private boolean valid;
    private List<InvarianceViolation> violations;
    private String summary;
    private double similarity;
    private Map<String, Integer> preStats;
    private Map<String, Integer> postStats;

    public List<InvarianceViolation> bySeverity(Severity severity) {
        return violations.stream().filter(v -> v.getSeverity() == severity).toList();
    }
}
