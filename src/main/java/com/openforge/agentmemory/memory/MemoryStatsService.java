package com.openforge.agentmemory.memory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.agentmemory.config.UpstreamGuard;
import com.openforge.agentmemory.embedding.EmbeddingGateway;
import com.openforge.agentmemory.exception.UpstreamException;
import com.openforge.agentmemory.vector.MilvusProperties;
import com.openforge.agentmemory.vector.VectorStore;
import com.openforge.agentmemory.vector.VectorStoreStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-only introspection for GET /stats. Never mutates state and never fails:
 * an unreachable store is reported as {@code status = "unavailable"}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryStatsService {

    private final VectorStore      vectorStore;
    private final EmbeddingGateway embeddingGateway;
    private final MilvusProperties milvusProps;
    private final UpstreamGuard    guard;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MemoryStats(
            String index,
            int    dimensions,
            String metric,
            String model,
            Long   approximateCount,
            String status,
            String details
    ) {}

    public MemoryStats stats() {
        try {
            VectorStoreStats s = guard.call(UpstreamGuard.VECTOR_STORE, vectorStore::stats);
            return new MemoryStats(s.collection(), s.dimensions(), s.metric(),
                    embeddingGateway.modelName(), s.approximateCount(), "healthy", null);
        } catch (UpstreamException e) {
            log.warn("[Stats] Vector store stats unavailable: {}", e.getMessage());
            return new MemoryStats(milvusProps.collectionName(), milvusProps.vectorDimensions(), "cosine",
                    embeddingGateway.modelName(), null, "unavailable", e.getMessage());
        }
    }
}
