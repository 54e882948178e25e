package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
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
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GlobalIntent {
    private List<String> palette;
    private Layout layout;
    private Density density;
    private Mood mood;
    private Contrast contrast;
    private String fontFamily;

    // zone -> {"fill": .., "border": ..}
    private Map<String, Map<String, String>> zoneColors;
}
