package com.openforge.agentmemory.hook;

import com.openforge.agentmemory.hook.AutoMemoryService.AgentTurn;
import com.openforge.agentmemory.hook.AutoMemoryService.Recall;
import com.openforge.agentmemory.hook.dto.AgentEndRequest;
import com.openforge.agentmemory.hook.dto.BeforeAgentStartRequest;
import com.openforge.agentmemory.hook.dto.HookResponses.AgentEndResponse;
import com.openforge.agentmemory.hook.dto.HookResponses.BeforeAgentStartResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lifecycle hooks called by the host agent runtime.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                               Description                  │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST /api/hooks/before-agent-start     recall → prependContext      │
 * │  POST /api/hooks/agent-end              classify + capture the turn  │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/hooks")
@RequiredArgsConstructor
public class HookController {

    private final AutoMemoryService autoMemoryService;

    @PostMapping("/before-agent-start")
    public ResponseEntity<BeforeAgentStartResponse> beforeAgentStart(
            @Valid @RequestBody BeforeAgentStartRequest req) {
        Recall recall = autoMemoryService.beforeAgentStart(req.owner(), req.prompt());
        return ResponseEntity.ok(new BeforeAgentStartResponse(recall.prependContext(), recall.recalled()));
    }

    @PostMapping("/agent-end")
    public ResponseEntity<AgentEndResponse> agentEnd(@Valid @RequestBody AgentEndRequest req) {
        int captured = autoMemoryService.afterAgentEnd(req.owner(),
                new AgentTurn(req.success(), req.messages() != null ? req.messages() : List.of()));
        return ResponseEntity.ok(new AgentEndResponse(captured));
    }
}
