package com.openforge.agentmemory.hook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openforge.agentmemory.capture.CaptureClassifier;
import com.openforge.agentmemory.capture.CaptureProperties;
import com.openforge.agentmemory.capture.CaptureService;
import com.openforge.agentmemory.capture.CaptureService.CaptureResult;
import com.openforge.agentmemory.exception.UpstreamException;
import com.openforge.agentmemory.exception.ValidationException;
import com.openforge.agentmemory.hook.AutoMemoryService.AgentTurn;
import com.openforge.agentmemory.hook.AutoMemoryService.Recall;
import com.openforge.agentmemory.hook.dto.AgentMessage;
import com.openforge.agentmemory.memory.MemoryCategory;
import com.openforge.agentmemory.memory.MemoryMatch;
import com.openforge.agentmemory.memory.MemoryMetadata;
import com.openforge.agentmemory.memory.MemoryRetrievalService;
import com.openforge.agentmemory.memory.MemoryRetrievalService.RecallQuery;
import com.openforge.agentmemory.memory.MemoryRetrievalService.RecallResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AutoMemoryService Tests")
class AutoMemoryServiceTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Mock private MemoryRetrievalService retrieval;
    @Mock private CaptureService         captureService;

    private AutoMemoryService service;

    @BeforeEach
    void setUp() {
        service = new AutoMemoryService(retrieval, new CaptureClassifier(CaptureProperties.defaults()),
                captureService, AutoMemoryProperties.defaults());
    }

    private static MemoryMatch match(String id, MemoryCategory category, String text) {
        return new MemoryMatch(id, 0.8,
                new MemoryMetadata("dev", category, "manual", Instant.EPOCH, 0, text));
    }

    private static AgentMessage message(String role, String content) {
        return new AgentMessage(role, TextNode.valueOf(content));
    }

    private static AgentMessage blocks(String role, String json) throws Exception {
        JsonNode content = JSON.readTree(json);
        return new AgentMessage(role, content);
    }

    @Nested
    @DisplayName("beforeAgentStart()")
    class BeforeAgentStart {

        @Test
        @DisplayName("Should wrap recalled memories in a relevant-memories block")
        void shouldFormatRecalledMemories() {
            when(retrieval.query(any())).thenReturn(new RecallResult("which database?", 2, List.of(
                    match("m1", MemoryCategory.DECISION, "Use Postgres for storage."),
                    match("m2", MemoryCategory.PREFERENCE, "Prefers short answers."))));

            Recall recall = service.beforeAgentStart("dev", "which database?");

            assertThat(recall.recalled()).isEqualTo(2);
            assertThat(recall.prependContext()).isEqualTo("""
                    <relevant-memories>
                    The following memories may be relevant to this conversation:
                    - [decision] Use Postgres for storage.
                    - [preference] Prefers short answers.
                    </relevant-memories>""");
        }

        @Test
        @DisplayName("Should query with the hook recall policy")
        void shouldUseHookRecallPolicy() {
            when(retrieval.query(any())).thenReturn(new RecallResult("which database?", 0, List.of()));

            service.beforeAgentStart("dev", "which database?");

            verify(retrieval).query(new RecallQuery("which database?", "dev", null, 3, 0.5));
        }

        @Test
        @DisplayName("Should skip prompts shorter than five characters")
        void shouldSkipShortPrompts() {
            assertThat(service.beforeAgentStart("dev", "hi")).isEqualTo(Recall.NONE);
            assertThat(service.beforeAgentStart("dev", null)).isEqualTo(Recall.NONE);
            verify(retrieval, never()).query(any());
        }

        @Test
        @DisplayName("Should inject nothing when nothing matches")
        void shouldInjectNothingWithoutMatches() {
            when(retrieval.query(any())).thenReturn(new RecallResult("which database?", 0, List.of()));

            Recall recall = service.beforeAgentStart("dev", "which database?");

            assertThat(recall.prependContext()).isNull();
            assertThat(recall.recalled()).isZero();
        }

        @Test
        @DisplayName("Should swallow recall failures")
        void shouldSwallowRecallFailures() {
            when(retrieval.query(any())).thenThrow(new UpstreamException("embedding call timed out after 31000 ms"));

            assertThat(service.beforeAgentStart("dev", "which database?")).isEqualTo(Recall.NONE);
        }

        @Test
        @DisplayName("Should do nothing when auto-recall is disabled")
        void shouldRespectDisabledRecall() {
            AutoMemoryService disabled = new AutoMemoryService(retrieval,
                    new CaptureClassifier(CaptureProperties.defaults()), captureService,
                    new AutoMemoryProperties(false, true, 0.5, 3, 5, 3));

            assertThat(disabled.beforeAgentStart("dev", "which database?")).isEqualTo(Recall.NONE);
            verify(retrieval, never()).query(any());
        }

        @Test
        @DisplayName("Should require an owner")
        void shouldRequireOwner() {
            assertThatThrownBy(() -> service.beforeAgentStart(" ", "which database?"))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("afterAgentEnd()")
    class AfterAgentEnd {

        @Test
        @DisplayName("Should capture user and assistant texts with their detected category")
        void shouldCaptureConversationalTexts() throws Exception {
            when(captureService.capture(eq("dev"), anyString(), anyString()))
                    .thenReturn(new CaptureResult(true, MemoryCategory.CONTEXT, "id", null));

            int captured = service.afterAgentEnd("dev", new AgentTurn(true, List.of(
                    message("system", "Always remember to be concise"),
                    message("user", "I prefer tabs over spaces"),
                    blocks("assistant", """
                            [{"type": "text", "text": "We decided to use Postgres for storage."},
                             {"type": "image", "url": "https://example.com/a.png"}]"""),
                    message("tool", "Remember: exit code 0"))));

            assertThat(captured).isEqualTo(2);
            verify(captureService).capture("dev", "I prefer tabs over spaces", "preference");
            verify(captureService).capture("dev", "We decided to use Postgres for storage.", "decision");
            verify(captureService, times(2)).capture(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("Should capture at most three texts per turn")
        void shouldLimitCapturesPerTurn() {
            when(captureService.capture(eq("dev"), anyString(), anyString()))
                    .thenReturn(new CaptureResult(true, MemoryCategory.CONTEXT, "id", null));

            service.afterAgentEnd("dev", new AgentTurn(true, List.of(
                    message("user", "I prefer tabs over spaces"),
                    message("user", "I prefer dark mode in every editor"),
                    message("user", "We decided to use Postgres for storage"),
                    message("user", "I realized the cache was stale all along"),
                    message("user", "Remember the deploy window is Friday"))));

            verify(captureService, times(3)).capture(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("Should count only texts that were actually stored")
        void shouldCountOnlyStoredTexts() {
            when(captureService.capture("dev", "I prefer tabs over spaces", "preference"))
                    .thenReturn(new CaptureResult(true, MemoryCategory.PREFERENCE, "id", null));
            when(captureService.capture("dev", "I prefer dark mode in every editor", "preference"))
                    .thenReturn(new CaptureResult(false, MemoryCategory.PREFERENCE, "old", "Similar memory already exists"));

            int captured = service.afterAgentEnd("dev", new AgentTurn(true, List.of(
                    message("user", "I prefer tabs over spaces"),
                    message("assistant", "I prefer dark mode in every editor"))));

            assertThat(captured).isEqualTo(1);
        }

        @Test
        @DisplayName("Should never re-capture injected memory context")
        void shouldSkipInjectedContext() {
            int captured = service.afterAgentEnd("dev", new AgentTurn(true, List.of(
                    message("user", "<relevant-memories>\n- [preference] I prefer tabs\n</relevant-memories>"))));

            assertThat(captured).isZero();
            verify(captureService, never()).capture(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("Should ignore failed turns")
        void shouldIgnoreFailedTurns() {
            int captured = service.afterAgentEnd("dev", new AgentTurn(false, List.of(
                    message("user", "I prefer tabs over spaces"))));

            assertThat(captured).isZero();
            verify(captureService, never()).capture(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("Should keep capturing after a single failure")
        void shouldSwallowCaptureFailures() {
            when(captureService.capture("dev", "I prefer tabs over spaces", "preference"))
                    .thenThrow(new UpstreamException("vectorStore is unavailable (circuit open)"));
            when(captureService.capture("dev", "We decided to use Postgres for storage", "decision"))
                    .thenReturn(new CaptureResult(true, MemoryCategory.DECISION, "id", null));

            int captured = service.afterAgentEnd("dev", new AgentTurn(true, List.of(
                    message("user", "I prefer tabs over spaces"),
                    message("user", "We decided to use Postgres for storage"))));

            assertThat(captured).isEqualTo(1);
        }

        @Test
        @DisplayName("Should tolerate empty turns")
        void shouldTolerateEmptyTurns() {
            assertThat(service.afterAgentEnd("dev", new AgentTurn(true, List.of()))).isZero();
            assertThat(service.afterAgentEnd("dev", null)).isZero();
        }
    }
}
