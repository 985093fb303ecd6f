package com.example.gateway.exception;

/**
 * An emergency override request was malformed or not permitted.
 */
public class OverrideRejectedException extends RuntimeException {

    public OverrideRejectedException(String message) {
        super(message);
    }
}
