package com.openforge.agentmemory.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body shared by every endpoint.
 *
 * <pre>
 * { "error": "File not found: MEMORY.md", "details": "..." }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String error,
        String details
) {
    public static ApiError of(String error) {
        return new ApiError(error, null);
    }
}
