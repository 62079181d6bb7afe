package com.openforge.agentmemory.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tuning for the indexing and retrieval pipelines.
 *
 * application.yml:
 *
 * memory:
 *   pipeline:
 *     max-chunk-size: 500
 *     upsert-batch-size: 100       # Vectorize-style stores cap batches at 100
 *     max-stored-text-length: 2000 # stored snippet only; embeddings see the full chunk
 *     default-top-k: 5
 *     default-min-score: 0.7
 *     max-top-k: 100
 */
@ConfigurationProperties(prefix = "memory.pipeline")
public record MemoryPipelineProperties(
        @DefaultValue("500")  int    maxChunkSize,
        @DefaultValue("100")  int    upsertBatchSize,
        @DefaultValue("2000") int    maxStoredTextLength,
        @DefaultValue("5")    int    defaultTopK,
        @DefaultValue("0.7")  double defaultMinScore,
        @DefaultValue("100")  int    maxTopK
) {

    public static final int MAX_UPSERT_BATCH_SIZE = 100;

    public static MemoryPipelineProperties defaults() {
        return new MemoryPipelineProperties(500, 100, 2000, 5, 0.7, 100);
    }

    /** Batch size actually used for upserts, always within 1..100. */
    public int effectiveBatchSize() {
        return Math.max(1, Math.min(upsertBatchSize, MAX_UPSERT_BATCH_SIZE));
    }
}
