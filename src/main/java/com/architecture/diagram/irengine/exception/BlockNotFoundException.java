package com.architecture.diagram.irengine.exception;

public class BlockNotFoundException extends IrEngineException {

    public BlockNotFoundException(String blockId) {
        super("Block not found: " + blockId);
    }
}
