package com.architecture.diagram.irengine.exception;

import com.architecture.diagram.irengine.dto.invariance.InvarianceCheckResult;
import lombok.Getter;

/**
 * Raised by the cosmetic transform pipeline under the fail-closed policy.
 */
@Getter
public class SemanticInvarianceException extends IrEngineException {

    private final InvarianceCheckResult result;

    public SemanticInvarianceException(String transformName, InvarianceCheckResult result) {
        super("Transform '" + transformName + "' changed diagram semantics: " + result.getSummary());
        this.result = result;
    }
}
