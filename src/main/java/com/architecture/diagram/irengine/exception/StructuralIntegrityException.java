package com.architecture.diagram.irengine.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a patch would leave an edge pointing at a block that no longer exists.
 * The whole patch is rejected and the prior version stays current.
 */
@Getter
public class StructuralIntegrityException extends IrEngineException {

    private final List<String> orphanedEdgeIds;

    public StructuralIntegrityException(List<String> orphanedEdgeIds) {
        super("Patch would orphan edges: " + orphanedEdgeIds);
        this.orphanedEdgeIds = List.copyOf(orphanedEdgeIds);
    }
}
