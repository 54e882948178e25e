package com.architecture.diagram.irengine.dto.patch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single user edit against the current version of a diagram.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedbackRequest {

    @NotBlank(message = "diagram_id is required")
    private String diagramId;

    @NotBlank(message = "action is required")
    private String action;

    private String blockId;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    // Optimistic check: reject when the current version is not this one
    @Positive(message = "base_version must be positive")
    private Integer baseVersion;
}
