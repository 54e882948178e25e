package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target-specific hints consumed by the PlantUML and Mermaid codecs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderingHints {

    private PlantUml plantuml;
    private Mermaid mermaid;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlantUml {
        @JsonProperty("plantuml_shape")
        private String shape;

        @JsonProperty("plantuml_color")
        private String color;

        @JsonProperty("plantuml_label")
        private String label;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Mermaid {
        @JsonProperty("mermaid_type")
        private String type;

        @JsonProperty("mermaid_id")
        private String id;
    }
}
