package com.architecture.diagram.irengine.exception;

public class DiagramNotFoundException extends IrEngineException {

    public DiagramNotFoundException(String diagramId) {
        super("Diagram not found: " + diagramId);
    }

    public DiagramNotFoundException(String diagramId, int irVersion) {
        super("Diagram " + diagramId + " has no version " + irVersion);
    }
}
