package com.mouse.oneup.exception;

/**
 * Raised when an internal pricing invariant is broken. Missing or invalid markets are
 * not exceptional and never raise this.
 */
public class PricingException extends RuntimeException {
    public PricingException() {
        super();
    }

    public PricingException(String message) {
        super(message);
    }

    public PricingException(String message, Throwable e) {
        super(message, e);
    }
}
