package com.pricelens.engine.error;

/**
 * Base type for failures the engine reports to its caller.
 */
public class PricingException extends RuntimeException {
    public PricingException(String message) {
        super(message);
    }

    public PricingException(String message, Throwable cause) {
        super(message, cause);
    }
}
