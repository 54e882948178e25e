package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Before/after statistics attached to a version produced by a patch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DiffSummary {
    private int blocksBefore;
    private int blocksAfter;
    private int edgesBefore;
    private int edgesAfter;

    private List<String> blocksAdded;
    private List<String> blocksRemoved;
    private List<String> blocksModified;
    private List<String> edgesAdded;
    private List<String> edgesRemoved;

    // e.g. "blocks=3->2; edges=4->2"
    private String description;
}
