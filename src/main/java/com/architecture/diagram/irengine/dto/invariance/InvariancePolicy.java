package com.architecture.diagram.irengine.dto.invariance;

/**
 * What the cosmetic transform pipeline does when a transform breaks semantic invariance.
 */
public enum InvariancePolicy {
    /** Reject the transformed output. */
    FAIL_CLOSED,
    /** Log the violations and return the transformed output anyway. */
    LOG_AND_CONTINUE
}
