package com.architecture.diagram.irengine.exception;

public class PatchValidationException extends IrEngineException {

    public PatchValidationException(String message) {
        super(message);
    }

    public PatchValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
