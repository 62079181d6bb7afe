package com.openforge.agentmemory.capture;

import com.openforge.agentmemory.memory.MemoryCategory;
import org.springframework.lang.Nullable;

/**
 * Outcome of {@link CaptureClassifier#classify}.
 *
 * @param capture  whether the text should be persisted
 * @param category set only when {@code capture} is true
 * @param reason   set only when {@code capture} is false
 */
public record CaptureDecision(
        boolean                  capture,
        @Nullable MemoryCategory category,
        @Nullable String         reason
) {

    public static CaptureDecision capture(MemoryCategory category) {
        return new CaptureDecision(true, category, null);
    }

    public static CaptureDecision reject(String reason) {
        return new CaptureDecision(false, null, reason);
    }
}
