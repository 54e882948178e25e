package com.architecture.diagram.irengine.dto.svg;

import com.architecture.diagram.irengine.dto.invariance.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructureComparison {

    private boolean equivalent;
    private List<StructureDifference> differences;
    private Map<String, Integer> originalStats;
    private Map<String, Integer> modifiedStats;

    public long countBySeverity(Severity severity) {
        return differences.stream().filter(d -> d.getSeverity() == severity).count();
    }
}
