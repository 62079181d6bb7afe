package com.openforge.agentmemory.embedding;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response from POST /v1/embeddings.
 *
 * Wire format:
 * {
 *   "object": "list",
 *   "data": [
 *     { "object": "embedding", "index": 0, "embedding": [0.1, -0.2, ...] }
 *   ],
 *   "model": "text-embedding-3-small",
 *   "usage": { "prompt_tokens": 8, "total_tokens": 8 }
 * }
 */
public record EmbeddingResponse(
        String object,
        List<EmbeddingData> data,
        String model,
        Usage usage
) {

    /** The vector of the first (and only) input, or {@code null} when the body carried none. */
    public List<Float> firstEmbedding() {
        if (data == null || data.isEmpty()) return null;
        return data.get(0).embedding();
    }

    public record EmbeddingData(
            String object,
            int index,
            List<Float> embedding
    ) {}

    public record Usage(
            @JsonProperty("prompt_tokens") int promptTokens,
            @JsonProperty("total_tokens")  int totalTokens
    ) {}
}
