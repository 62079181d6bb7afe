package com.openforge.agentmemory.capture;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.agentmemory.config.UpstreamGuard;
import com.openforge.agentmemory.embedding.EmbeddingGateway;
import com.openforge.agentmemory.exception.ValidationException;
import com.openforge.agentmemory.memory.MemoryCategory;
import com.openforge.agentmemory.memory.MemoryIdGenerator;
import com.openforge.agentmemory.memory.MemoryMatch;
import com.openforge.agentmemory.memory.MemoryRecord;
import com.openforge.agentmemory.memory.MemoryRetrievalService;
import com.openforge.agentmemory.vector.MilvusCollectionManager;
import com.openforge.agentmemory.vector.VectorFilter;
import com.openforge.agentmemory.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Capture pipeline: classify → embed → near-duplicate check → single-record upsert.
 *
 * An unclassifiable or already-known text is not an error: the result says
 * {@code captured = false} and carries the reason. Only missing input and
 * upstream failures throw.
 */
@Slf4j
@Service
public class CaptureService {

    private final CaptureClassifier      classifier;
    private final MemoryIdGenerator      idGenerator;
    private final EmbeddingGateway       embeddingGateway;
    private final VectorStore            vectorStore;
    private final MemoryRetrievalService retrieval;
    private final CaptureProperties      props;
    private final UpstreamGuard          guard;
    private final Clock                  clock;

    public CaptureService(CaptureClassifier classifier,
                          MemoryIdGenerator idGenerator,
                          EmbeddingGateway embeddingGateway,
                          VectorStore vectorStore,
                          MemoryRetrievalService retrieval,
                          CaptureProperties props,
                          UpstreamGuard guard,
                          Optional<Clock> clock) {
        this.classifier       = classifier;
        this.idGenerator      = idGenerator;
        this.embeddingGateway = embeddingGateway;
        this.vectorStore      = vectorStore;
        this.retrieval        = retrieval;
        this.props            = props;
        this.guard            = guard;
        this.clock            = clock.orElseGet(Clock::systemUTC);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CaptureResult(
            boolean                  captured,
            @Nullable MemoryCategory category,
            @Nullable String         id,
            @Nullable String         reason
    ) {
        static CaptureResult rejected(String reason) {
            return new CaptureResult(false, null, null, reason);
        }
    }

    /**
     * @param classification explicit category; when present the trigger
     *                       requirement is skipped but the gates still apply
     * @throws ValidationException when owner or content is missing, or the
     *                             classification is not a known category
     */
    public CaptureResult capture(String owner, String content, @Nullable String classification) {
        if (owner == null || owner.isBlank()) throw new ValidationException("owner is required");
        if (content == null || content.isBlank()) throw new ValidationException("content is required");
        if (owner.length() > MilvusCollectionManager.MAX_OWNER_LENGTH) {
            throw new ValidationException(
                    "owner must be at most %d characters".formatted(MilvusCollectionManager.MAX_OWNER_LENGTH));
        }
        MemoryCategory explicit = MemoryCategory.fromWireName(classification);

        MemoryCategory category;
        if (explicit != null) {
            Optional<String> rejection = classifier.gate(content);
            if (rejection.isPresent()) {
                log.debug("[Capture] owner={} rejected: {}", owner, rejection.get());
                return CaptureResult.rejected(rejection.get());
            }
            category = explicit;
        } else {
            CaptureDecision decision = classifier.classify(content);
            if (!decision.capture()) {
                log.debug("[Capture] owner={} rejected: {}", owner, decision.reason());
                return CaptureResult.rejected(decision.reason());
            }
            category = decision.category();
        }

        List<Float> vector = guard.call(UpstreamGuard.EMBEDDING, () -> embeddingGateway.embed(content));

        if (props.duplicateCheck()) {
            List<MemoryMatch> near = retrieval.search(
                    vector, new VectorFilter(owner, category), 1, props.duplicateThreshold());
            if (!near.isEmpty()) {
                MemoryMatch existing = near.get(0);
                log.info("[Capture] owner={} duplicate of {} (score={})", owner, existing.id(), existing.score());
                return new CaptureResult(false, category, existing.id(),
                        "Similar memory already exists (score %.3f)".formatted(existing.score()));
            }
        }

        String id = idGenerator.identity(owner, props.source(), content);
        MemoryRecord record = new MemoryRecord(
                id,
                vector,
                owner,
                category,
                props.source(),
                clock.instant(),
                0,
                content.length() > props.maxStoredTextLength()
                        ? content.substring(0, props.maxStoredTextLength())
                        : content);
        guard.run(UpstreamGuard.VECTOR_STORE, () -> vectorStore.upsert(List.of(record)));

        log.info("[Capture] owner={} category={} id={}", owner, category.wireName(), id);
        return new CaptureResult(true, category, id, null);
    }
}
