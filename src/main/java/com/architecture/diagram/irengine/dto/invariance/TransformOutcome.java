package com.architecture.diagram.irengine.dto.invariance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of running cosmetic transforms over an SVG.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformOutcome {

    private String svg;
    private List<String> transforms;
    private InvarianceCheckResult check;
    private boolean invariancePreserved;
}
