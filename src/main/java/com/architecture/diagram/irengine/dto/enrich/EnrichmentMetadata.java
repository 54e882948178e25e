package com.architecture.diagram.irengine.dto.enrich;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnrichmentMetadata {
    private String generatedBy;
    private String schemaVersion;
    private String sourceSystem;
    private List<ValidationMessage> validation;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidationMessage {
        private String severity;   // info, warning
        private String message;
    }
}
