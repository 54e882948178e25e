package com.architecture.diagram.irengine.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when an enriched document fails post-enrichment validation.
 * Indicates a defect in the enrichment rules rather than bad input.
 */
@Getter
public class EnrichmentException extends IrEngineException {

    private final List<String> problems;

    public EnrichmentException(List<String> problems) {
        super("Enriched IR failed validation: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
