package com.openforge.agentmemory.exception;

/**
 * A referenced external resource (for example a source file in a blob bucket) does not exist.
 */
public class NotFoundException extends RuntimeException {

    private final String resource;

    public NotFoundException(String resource, String message) {
        super(message);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
