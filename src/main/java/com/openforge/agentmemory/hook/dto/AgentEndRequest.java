package com.openforge.agentmemory.hook.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for POST /api/hooks/agent-end.
 */
public record AgentEndRequest(

        @NotBlank
        String owner,

        boolean success,

        List<AgentMessage> messages
) {
}
