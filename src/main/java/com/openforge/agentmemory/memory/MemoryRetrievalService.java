package com.openforge.agentmemory.memory;

import com.openforge.agentmemory.config.UpstreamGuard;
import com.openforge.agentmemory.embedding.EmbeddingGateway;
import com.openforge.agentmemory.exception.ValidationException;
import com.openforge.agentmemory.vector.VectorFilter;
import com.openforge.agentmemory.vector.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Retrieval pipeline: embed the query → nearest neighbours under owner / category
 * equality filters → drop everything below {@code minScore}.
 *
 * The store's ranking is authoritative; results keep its order and are never re-sorted.
 * Out-of-range {@code topK} / {@code minScore} are clamped, not rejected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryRetrievalService {

    private final EmbeddingGateway         embeddingGateway;
    private final VectorStore              vectorStore;
    private final MemoryPipelineProperties props;
    private final UpstreamGuard            guard;

    /**
     * Ephemeral query intent. Null fields fall back to the pipeline defaults.
     */
    public record RecallQuery(
            String                   text,
            @Nullable String         owner,
            @Nullable MemoryCategory category,
            @Nullable Integer        topK,
            @Nullable Double         minScore
    ) {
        public static RecallQuery of(String text) {
            return new RecallQuery(text, null, null, null, null);
        }
    }

    public record RecallResult(String query, int count, List<MemoryMatch> matches) {}

    public RecallResult query(RecallQuery query) {
        if (query == null || query.text() == null || query.text().isBlank()) {
            throw new ValidationException("query is required");
        }

        int    topK     = clampTopK(query.topK());
        double minScore = clampMinScore(query.minScore());
        VectorFilter filter = new VectorFilter(query.owner(), query.category());

        List<Float> vector = guard.call(UpstreamGuard.EMBEDDING, () -> embeddingGateway.embed(query.text()));
        List<MemoryMatch> matches = search(vector, filter, topK, minScore);

        log.info("[Recall] owner={} category={} topK={} minScore={} → {} matches",
                filter.owner(), filter.category(), topK, minScore, matches.size());
        return new RecallResult(query.text(), matches.size(), matches);
    }

    /**
     * Nearest neighbours of an already-embedded vector, thresholded.
     * Used by the capture pipeline's duplicate check.
     */
    public List<MemoryMatch> search(List<Float> vector, VectorFilter filter, int topK, double minScore) {
        List<MemoryMatch> raw = guard.call(UpstreamGuard.VECTOR_STORE,
                () -> vectorStore.query(vector, filter, topK));
        return raw.stream()
                .filter(m -> m.score() >= minScore)
                .toList();
    }

    // ── Clamping ─────────────────────────────────────────────────────────────

    int clampTopK(@Nullable Integer requested) {
        int topK = requested == null ? props.defaultTopK() : requested;
        return Math.max(1, Math.min(topK, Math.max(1, props.maxTopK())));
    }

    double clampMinScore(@Nullable Double requested) {
        double minScore = requested == null || requested.isNaN() ? props.defaultMinScore() : requested;
        return Math.max(0.0, Math.min(minScore, 1.0));
    }
}
