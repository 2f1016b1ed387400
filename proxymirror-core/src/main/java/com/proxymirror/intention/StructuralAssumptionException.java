package com.proxymirror.intention;

/**
 * Thrown when the presenter does not have the shape the intention relies on, for
 * example a proxy property that is not initialized with an object literal.
 */
public class StructuralAssumptionException extends RuntimeException {

    public StructuralAssumptionException(String message) {
        super(message);
    }
}
