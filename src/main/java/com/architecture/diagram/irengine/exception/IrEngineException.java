package com.architecture.diagram.irengine.exception;

/**
 * Root of every error raised by the diagram IR engine.
 */
public class IrEngineException extends RuntimeException {

    public IrEngineException(String message) {
        super(message);
    }

    public IrEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
