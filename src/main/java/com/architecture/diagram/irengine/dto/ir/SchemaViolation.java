package com.architecture.diagram.irengine.dto.ir;

import lombok.Value;

/**
 * A single schema failure: JSON-pointer-like path plus message.
 */
@Value
public class SchemaViolation {

    String path;
    String message;

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
