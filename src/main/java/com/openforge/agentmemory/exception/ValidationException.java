package com.openforge.agentmemory.exception;

/**
 * A required request field is missing or malformed. Always caused by the caller.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
