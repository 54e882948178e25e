package com.architecture.diagram.irengine.dto.svg;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning knobs for the structural analyzer.
 */
@Value
@Builder
public class AnalysisOptions {

    public static final AnalysisOptions DEFAULT = AnalysisOptions.builder().build();

    /**
     * Match still-unresolved edge endpoints to the nearest node centre. Results are tagged
     * {@link EndpointResolution#GEOMETRIC} and never replace an exact match.
     */
    @Builder.Default
    boolean geometricEndpointFallback = false;
}
