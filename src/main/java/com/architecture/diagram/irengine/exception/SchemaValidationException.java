package com.architecture.diagram.irengine.exception;

import com.architecture.diagram.irengine.dto.ir.SchemaViolation;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a payload fails structural validation against the IR schema.
 * The caller must not persist the rejected document.
 */
@Getter
public class SchemaValidationException extends IrEngineException {

    private final List<SchemaViolation> violations;

    public SchemaValidationException(List<SchemaViolation> violations) {
        super("Schema validation failed: " + violations.stream()
                .map(SchemaViolation::toString)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public SchemaValidationException(String path, String message, Throwable cause) {
        super("Schema validation failed: " + path + ": " + message, cause);
        this.violations = List.of(new SchemaViolation(path, message));
    }
}
