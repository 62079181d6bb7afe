package com.openforge.agentmemory.hook.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /api/hooks/before-agent-start.
 *
 * @param owner  the agent whose memories are recalled
 * @param prompt the user prompt about to be handled; may be empty
 */
public record BeforeAgentStartRequest(

        @NotBlank
        String owner,

        String prompt
) {
}
