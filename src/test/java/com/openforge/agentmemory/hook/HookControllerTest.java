package com.openforge.agentmemory.hook;

import com.openforge.agentmemory.hook.AutoMemoryService.AgentTurn;
import com.openforge.agentmemory.hook.AutoMemoryService.Recall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HookController.class)
@DisplayName("HookController Tests")
class HookControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockitoBean private AutoMemoryService autoMemoryService;

    @Test
    @DisplayName("before-agent-start returns the context to prepend")
    void beforeAgentStartReturnsContext() throws Exception {
        when(autoMemoryService.beforeAgentStart("dev", "which database do we use?"))
                .thenReturn(new Recall("<relevant-memories>\n...\n</relevant-memories>", 1));

        mockMvc.perform(post("/api/hooks/before-agent-start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"owner\": \"dev\", \"prompt\": \"which database do we use?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prependContext").value("<relevant-memories>\n...\n</relevant-memories>"))
                .andExpect(jsonPath("$.recalled").value(1));
    }

    @Test
    @DisplayName("before-agent-start omits prependContext when nothing was recalled")
    void beforeAgentStartWithoutRecall() throws Exception {
        when(autoMemoryService.beforeAgentStart("dev", "hi")).thenReturn(Recall.NONE);

        mockMvc.perform(post("/api/hooks/before-agent-start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"owner\": \"dev\", \"prompt\": \"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prependContext").doesNotExist())
                .andExpect(jsonPath("$.recalled").value(0));
    }

    @Test
    @DisplayName("before-agent-start without owner is a 400")
    void beforeAgentStartRequiresOwner() throws Exception {
        mockMvc.perform(post("/api/hooks/before-agent-start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"which database do we use?\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("owner is required"));

        verifyNoInteractions(autoMemoryService);
    }

    @Test
    @DisplayName("agent-end accepts string and block content")
    void agentEndParsesMessages() throws Exception {
        when(autoMemoryService.afterAgentEnd(eq("dev"), any())).thenReturn(2);

        mockMvc.perform(post("/api/hooks/agent-end")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "owner": "dev",
                                  "success": true,
                                  "messages": [
                                    {"role": "user", "content": "I prefer tabs over spaces"},
                                    {"role": "assistant", "content": [
                                      {"type": "text", "text": "We decided to use Postgres."},
                                      {"type": "tool_use", "name": "search"}
                                    ]}
                                  ]
                                }"""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.captured").value(2));

        ArgumentCaptor<AgentTurn> turn = ArgumentCaptor.forClass(AgentTurn.class);
        verify(autoMemoryService).afterAgentEnd(eq("dev"), turn.capture());
        assertThat(turn.getValue().success()).isTrue();
        assertThat(turn.getValue().messages()).hasSize(2);
        assertThat(turn.getValue().messages().get(0).texts()).containsExactly("I prefer tabs over spaces");
        assertThat(turn.getValue().messages().get(1).texts()).containsExactly("We decided to use Postgres.");
    }

    @Test
    @DisplayName("agent-end without messages reports nothing captured")
    void agentEndWithoutMessages() throws Exception {
        when(autoMemoryService.afterAgentEnd(eq("dev"), any())).thenReturn(0);

        mockMvc.perform(post("/api/hooks/agent-end")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"owner\": \"dev\", \"success\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.captured").value(0));
    }
}
