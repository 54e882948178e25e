package com.architecture.diagram.irengine.dto.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical versioned IR document. Instances are never modified; every edit mints a new
 * version whose {@code parentVersion} is the version it was derived from.
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"diagram_id", "ir_version", "parent_version", "ir"})
public class IrVersion {

    @JsonProperty("diagram_id")
    String diagramId;

    @JsonProperty("ir_version")
    int irVersion;

    @JsonProperty("parent_version")
    Integer parentVersion;

    IrDocument ir;

    public Diagram diagram() {
        return ir.getDiagram();
    }

    public boolean root() {
        return parentVersion == null;
    }
}
