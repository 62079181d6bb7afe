package com.openforge.agentmemory.hook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response bodies of the hook endpoints.
 */
public final class HookResponses {

    private HookResponses() {}

    /** {@code prependContext} is omitted when nothing was recalled. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BeforeAgentStartResponse(String prependContext, int recalled) {}

    public record AgentEndResponse(int captured) {}
}
