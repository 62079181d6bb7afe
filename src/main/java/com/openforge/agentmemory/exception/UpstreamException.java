package com.openforge.agentmemory.exception;

/**
 * An external collaborator (embedding endpoint, vector store, blob store) failed or timed out.
 *
 * The message is forwarded to API callers as {@code details}; the cause is only logged.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
