package com.architecture.diagram.irengine.exception;

public class VersionConflictException extends IrEngineException {

    public VersionConflictException(String diagramId, int expected, int actual) {
        super(String.format("Diagram %s is at version %d, expected %d", diagramId, actual, expected));
    }

    public VersionConflictException(String diagramId, int irVersion) {
        super(String.format("Version %d of diagram %s already exists", irVersion, diagramId));
    }
}
