package com.architecture.diagram.irengine.dto.codec;

import com.architecture.diagram.irengine.dto.ir.IrVersion;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * IR recovered from an SVG, plus the edges that could not be tied to two nodes.
 */
@Value
@Builder
public class SvgImportResult {
    IrVersion version;
    boolean fromMetadata;
    @Builder.Default
    List<String> unresolvedEdgeIds = List.of();
}
