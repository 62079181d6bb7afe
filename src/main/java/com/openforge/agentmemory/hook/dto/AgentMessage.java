package com.openforge.agentmemory.hook.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One message of a finished agent turn, as reported by the host runtime.
 *
 * {@code content} is either a plain string or an array of content blocks,
 * of which only {@code {"type": "text", "text": "..."}} blocks are read.
 */
public record AgentMessage(
        String   role,
        JsonNode content
) {

    public boolean isConversational() {
        return "user".equals(role) || "assistant".equals(role);
    }

    public List<String> texts() {
        List<String> texts = new ArrayList<>();
        if (content == null || content.isNull()) return texts;

        if (content.isTextual()) {
            texts.add(content.asText());
        } else if (content.isArray()) {
            for (JsonNode block : content) {
                if (block.isObject()
                        && "text".equals(block.path("type").asText(null))
                        && block.path("text").isTextual()) {
                    texts.add(block.get("text").asText());
                }
            }
        }
        return texts;
    }
}
