package com.architecture.diagram.irengine.exception;

import lombok.Getter;

@Getter
public class UnsupportedActionException extends IrEngineException {

    private final String action;

    public UnsupportedActionException(String action) {
        super("Unsupported feedback action: " + action);
        this.action = action;
    }
}
