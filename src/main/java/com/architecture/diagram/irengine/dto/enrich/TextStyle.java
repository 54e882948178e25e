package com.architecture.diagram.irengine.dto.enrich;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextStyle {
    private String fontFamily;
    private int fontSize;
    private String textColor;
}
