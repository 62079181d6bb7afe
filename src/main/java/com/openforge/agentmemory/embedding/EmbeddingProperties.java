package com.openforge.agentmemory.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the OpenAI-compatible text embedding endpoint.
 *
 * application.yml:
 *
 * memory:
 *   embedding:
 *     base-url: https://api.openai.com/v1
 *     api-key: ${EMBEDDING_API_KEY:sk-placeholder}
 *     model: text-embedding-3-small
 *     dimensions: 768
 *     timeout-seconds: 30
 *
 * {@code dimensions} must equal memory.milvus.vector-dimensions; the
 * text-embedding-3-* models shorten their output to the requested size.
 */
@ConfigurationProperties(prefix = "memory.embedding")
public record EmbeddingProperties(
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        String apiKey,
        @DefaultValue("text-embedding-3-small") String model,
        @DefaultValue("768") int dimensions,
        @DefaultValue("30") int timeoutSeconds
) {}
