package com.example.gateway.exception;

/**
 * A declared request context is malformed, for example an unparseable event date.
 */
public class InvalidContextException extends Exception {

    public InvalidContextException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidContextException(String message) {
        super(message);
    }
}
