package com.architecture.diagram.irengine.exception;

/**
 * Raised when SVG markup is not well-formed XML. Not retryable.
 */
public class SvgParseException extends IrEngineException {

    public SvgParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
