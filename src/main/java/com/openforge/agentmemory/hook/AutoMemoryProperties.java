package com.openforge.agentmemory.hook;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Policy of the lifecycle hooks.
 *
 * application.yml:
 *
 * memory:
 *   auto:
 *     auto-recall: true
 *     auto-capture: true
 *     min-recall-score: 0.5      # looser than the query default; recall is a hint, not an answer
 *     recall-limit: 3
 *     min-prompt-length: 5
 *     max-captures-per-turn: 3
 */
@ConfigurationProperties(prefix = "memory.auto")
public record AutoMemoryProperties(
        @DefaultValue("true") boolean autoRecall,
        @DefaultValue("true") boolean autoCapture,
        @DefaultValue("0.5")  double  minRecallScore,
        @DefaultValue("3")    int     recallLimit,
        @DefaultValue("5")    int     minPromptLength,
        @DefaultValue("3")    int     maxCapturesPerTurn
) {

    public static AutoMemoryProperties defaults() {
        return new AutoMemoryProperties(true, true, 0.5, 3, 5, 3);
    }
}
