package com.architecture.diagram.irengine.dto.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Optional user taste input. Every field is advisory; unknown values fall back to defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AestheticIntent {

    @JsonAlias("global_intent")
    private Map<String, String> globalIntent;   // mood, density, contrast

    @JsonAlias("user_palette")
    private List<String> userPalette;

    private Map<String, Object> metadata;       // may carry its own "userPalette"
}
