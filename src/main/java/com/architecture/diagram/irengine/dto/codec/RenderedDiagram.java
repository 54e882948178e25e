package com.architecture.diagram.irengine.dto.codec;

import lombok.Builder;
import lombok.Value;

/**
 * Encoded renderer input plus, when a renderer produced one, the resulting SVG.
 */
@Value
@Builder
public class RenderedDiagram {
    DiagramFormat format;
    String source;
    String fingerprint;
    String svg;
    DiagramFormat renderedBy;   // SVG when the built-in renderer was used
}
