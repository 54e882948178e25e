package com.architecture.diagram.irengine.dto.enrich;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Visual styling of an enriched node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStyle {

    private String fillColor;   // "#RRGGBB"
    private String borderColor;
    private String textColor;
    private Integer borderWidth; // pixels
    private Integer fontSize;
    private String fontFamily;
    private Integer padding;
}
