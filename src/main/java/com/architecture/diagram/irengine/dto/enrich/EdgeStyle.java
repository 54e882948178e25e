package com.architecture.diagram.irengine.dto.enrich;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Line preset for a relationship type.
 * Colour is resolved against the palette at enrichment time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeStyle {

    private String lineStyle;   // solid, dashed, dotted
    private String arrowShape;  // normal, open
    private double curvature;
    private int paletteIndex;   // negative counts from the end of the palette
}
