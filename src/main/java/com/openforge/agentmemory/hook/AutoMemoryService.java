package com.openforge.agentmemory.hook;

import com.openforge.agentmemory.capture.CaptureClassifier;
import com.openforge.agentmemory.capture.CaptureDecision;
import com.openforge.agentmemory.capture.CaptureService;
import com.openforge.agentmemory.capture.CaptureService.CaptureResult;
import com.openforge.agentmemory.exception.ValidationException;
import com.openforge.agentmemory.hook.dto.AgentMessage;
import com.openforge.agentmemory.memory.MemoryMatch;
import com.openforge.agentmemory.memory.MemoryRetrievalService;
import com.openforge.agentmemory.memory.MemoryRetrievalService.RecallQuery;
import com.openforge.agentmemory.memory.MemoryRetrievalService.RecallResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Glue between the host agent's lifecycle and the memory pipelines.
 *
 *   beforeAgentStart() - AUTO-RECALL: prompt → relevant memories → context block to prepend
 *   afterAgentEnd()    - AUTO-CAPTURE: turn messages → classifier → capture pipeline
 *
 * Memory is best-effort here. Pipeline failures are logged at WARN and turned
 * into "nothing recalled" / "nothing captured"; they never reach the agent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoMemoryService {

    static final String CONTEXT_HEADER = "The following memories may be relevant to this conversation:";

    private final MemoryRetrievalService retrieval;
    private final CaptureClassifier      classifier;
    private final CaptureService         captureService;
    private final AutoMemoryProperties   props;

    /**
     * @param prependContext {@code null} when nothing was recalled
     */
    public record Recall(@Nullable String prependContext, int recalled) {
        static final Recall NONE = new Recall(null, 0);
    }

    public record AgentTurn(boolean success, List<AgentMessage> messages) {}

    // ── Auto-recall ──────────────────────────────────────────────────────────

    public Recall beforeAgentStart(String owner, @Nullable String prompt) {
        requireOwner(owner);
        if (!props.autoRecall() || prompt == null || prompt.length() < props.minPromptLength()) {
            return Recall.NONE;
        }

        try {
            RecallResult result = retrieval.query(new RecallQuery(
                    prompt, owner, null, props.recallLimit(), props.minRecallScore()));
            if (result.count() == 0) return Recall.NONE;

            log.info("[Hooks] owner={} injecting {} memories into context", owner, result.count());
            return new Recall(formatContext(result.matches()), result.count());
        } catch (RuntimeException e) {
            log.warn("[Hooks] owner={} recall failed, continuing without memories: {}", owner, e.getMessage());
            return Recall.NONE;
        }
    }

    /**
     * Wraps recalled memories in the {@value CaptureClassifier#INJECTED_MEMORY_MARKER}
     * block that the capture gates recognise and refuse to re-capture.
     */
    static String formatContext(List<MemoryMatch> matches) {
        StringBuilder sb = new StringBuilder(CaptureClassifier.INJECTED_MEMORY_MARKER)
                .append('\n').append(CONTEXT_HEADER).append('\n');
        for (MemoryMatch m : matches) {
            sb.append("- [").append(m.metadata().category().wireName()).append("] ")
              .append(m.metadata().rawText()).append('\n');
        }
        return sb.append("</relevant-memories>").toString();
    }

    // ── Auto-capture ─────────────────────────────────────────────────────────

    /**
     * @return number of memories actually written this turn
     */
    public int afterAgentEnd(String owner, AgentTurn turn) {
        requireOwner(owner);
        if (!props.autoCapture() || turn == null || !turn.success()
                || turn.messages() == null || turn.messages().isEmpty()) {
            return 0;
        }

        List<String> candidates = new ArrayList<>();
        for (AgentMessage message : turn.messages()) {
            if (message == null || !message.isConversational()) continue;
            for (String text : message.texts()) {
                if (text != null && !text.isEmpty() && classifier.shouldCapture(text)) {
                    candidates.add(text);
                }
            }
        }

        int stored = 0;
        for (String text : candidates.stream().limit(Math.max(0, props.maxCapturesPerTurn())).toList()) {
            CaptureDecision decision = classifier.classify(text);
            try {
                CaptureResult result = captureService.capture(owner, text, decision.category().wireName());
                if (result.captured()) stored++;
            } catch (RuntimeException e) {
                log.warn("[Hooks] owner={} capture failed: {}", owner, e.getMessage());
            }
        }

        if (stored > 0) {
            log.info("[Hooks] owner={} auto-captured {} memories", owner, stored);
        }
        return stored;
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new ValidationException("owner is required");
        }
    }
}
