package com.openforge.agentmemory.memory;

import com.openforge.agentmemory.blob.BlobStore;
import com.openforge.agentmemory.blob.BlobStoreProperties;
import com.openforge.agentmemory.config.UpstreamGuard;
import com.openforge.agentmemory.embedding.EmbeddingGateway;
import com.openforge.agentmemory.exception.ConfigurationException;
import com.openforge.agentmemory.exception.NotFoundException;
import com.openforge.agentmemory.exception.ValidationException;
import com.openforge.agentmemory.vector.MilvusCollectionManager;
import com.openforge.agentmemory.vector.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Indexing pipeline: text → chunks → embeddings → deterministic ids → batched upsert.
 *
 *   index()         - direct index request (manual memories, the store tool)
 *   indexDocument() - bulk ingestion of a fetched source document
 *   indexFile()     - bulk ingestion from the owner's blob bucket
 *
 * A failed batch fails the whole call, even if earlier batches were written;
 * because ids are content-derived, the caller can simply retry.
 */
@Slf4j
@Service
public class MemoryIndexingService {

    public static final String MANUAL_SOURCE = "manual";

    private final TextChunker              chunker;
    private final MemoryIdGenerator        idGenerator;
    private final EmbeddingGateway         embeddingGateway;
    private final VectorStore              vectorStore;
    private final BlobStore                blobStore;
    private final BlobStoreProperties      blobProps;
    private final MemoryPipelineProperties props;
    private final UpstreamGuard            guard;
    private final Clock                    clock;

    public MemoryIndexingService(TextChunker chunker,
                                 MemoryIdGenerator idGenerator,
                                 EmbeddingGateway embeddingGateway,
                                 VectorStore vectorStore,
                                 BlobStore blobStore,
                                 BlobStoreProperties blobProps,
                                 MemoryPipelineProperties props,
                                 UpstreamGuard guard,
                                 Optional<Clock> clock) {
        this.chunker          = chunker;
        this.idGenerator      = idGenerator;
        this.embeddingGateway = embeddingGateway;
        this.vectorStore      = vectorStore;
        this.blobStore        = blobStore;
        this.blobProps        = blobProps;
        this.props            = props;
        this.guard            = guard;
        this.clock            = clock.orElseGet(Clock::systemUTC);
    }

    /** Supplies the text of a source document; empty when the document does not exist. */
    @FunctionalInterface
    public interface DocumentFetcher {
        Optional<String> fetch();
    }

    public record IndexResult(int count, List<String> ids) {}

    public record FileIndexResult(String file, int chunks, int indexed) {}

    // ── Direct index ─────────────────────────────────────────────────────────

    /**
     * Index free text for an owner.
     *
     * @param category defaults to {@link MemoryCategory#CONTEXT}
     * @param source   defaults to {@value #MANUAL_SOURCE}
     */
    public IndexResult index(String owner,
                             String text,
                             @Nullable MemoryCategory category,
                             @Nullable String source) {
        return index(owner, text, category, source, null);
    }

    /**
     * As {@link #index(String, String, MemoryCategory, String)}, with an optional
     * chunk position recorded on every chunk instead of its own position.
     * Ids stay content-derived, so the override never merges distinct chunks.
     */
    public IndexResult index(String owner,
                             String text,
                             @Nullable MemoryCategory category,
                             @Nullable String source,
                             @Nullable Integer chunkIndex) {
        requireText(owner, "owner");
        requireText(text, "text");
        if (chunkIndex != null && chunkIndex < 0) {
            throw new ValidationException("chunkIndex must not be negative");
        }
        String effectiveSource = source == null || source.isBlank() ? MANUAL_SOURCE : source.trim();
        checkLengths(owner, effectiveSource);

        List<String> chunks = chunker.chunk(text);
        List<String> ids = write(owner, chunks,
                category != null ? category : MemoryCategory.CONTEXT, effectiveSource, chunkIndex);

        log.info("[Index] owner={} source={} chunks={}", owner, effectiveSource, ids.size());
        return new IndexResult(ids.size(), ids);
    }

    // ── Bulk ingestion ───────────────────────────────────────────────────────

    /**
     * Fetch a document and index all of its chunks as {@link MemoryCategory#CONTEXT}
     * with the document name as source.
     *
     * @throws NotFoundException when the fetcher finds no document
     */
    public FileIndexResult indexDocument(String owner, String source, DocumentFetcher fetcher) {
        requireText(owner, "owner");
        requireText(source, "file");
        checkLengths(owner, source);

        String text = guard.call(UpstreamGuard.BLOB_STORE, fetcher::fetch)
                .orElseThrow(() -> new NotFoundException(source, "File not found: " + source));

        List<String> chunks = chunker.chunk(text);
        List<String> ids = write(owner, chunks, MemoryCategory.CONTEXT, source, null);

        log.info("[Index] owner={} file={} chunks={} indexed={}", owner, source, chunks.size(), ids.size());
        return new FileIndexResult(source, chunks.size(), ids.size());
    }

    /**
     * Index a file from the owner's bucket.
     *
     * @throws ConfigurationException (caller fault) when the owner has no bucket mapping
     */
    public FileIndexResult indexFile(String owner, String file) {
        requireText(owner, "owner");
        requireText(file, "file");
        BlobStore.checkKey(file);
        String bucket = blobProps.bucketFor(owner)
                .orElseThrow(() -> ConfigurationException.caller("Unknown owner: " + owner));
        return indexDocument(owner, file, () -> blobStore.read(bucket, file));
    }

    // ── Pipeline ─────────────────────────────────────────────────────────────

    private List<String> write(String owner, List<String> chunks, MemoryCategory category, String source,
                               @Nullable Integer chunkIndex) {
        Instant now = clock.instant();
        List<MemoryRecord> records = new ArrayList<>(chunks.size());

        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            // the embedding sees the full chunk; only the stored snippet is capped
            List<Float> vector = guard.call(UpstreamGuard.EMBEDDING, () -> embeddingGateway.embed(chunk));
            records.add(new MemoryRecord(
                    idGenerator.identity(owner, source, chunk),
                    vector,
                    owner,
                    category,
                    source,
                    now,
                    chunkIndex != null ? chunkIndex : i,
                    truncate(chunk, props.maxStoredTextLength())));
        }

        int batchSize = props.effectiveBatchSize();
        for (int from = 0; from < records.size(); from += batchSize) {
            List<MemoryRecord> batch = records.subList(from, Math.min(from + batchSize, records.size()));
            guard.run(UpstreamGuard.VECTOR_STORE, () -> vectorStore.upsert(batch));
            log.debug("[Index] upserted batch {}..{} for owner={}", from, from + batch.size() - 1, owner);
        }

        return records.stream().map(MemoryRecord::id).toList();
    }

    // ── Validation helpers ───────────────────────────────────────────────────

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    static void checkLengths(String owner, String source) {
        if (owner.length() > MilvusCollectionManager.MAX_OWNER_LENGTH) {
            throw new ValidationException(
                    "owner must be at most %d characters".formatted(MilvusCollectionManager.MAX_OWNER_LENGTH));
        }
        if (source.length() > MilvusCollectionManager.MAX_SOURCE_LENGTH) {
            throw new ValidationException(
                    "source must be at most %d characters".formatted(MilvusCollectionManager.MAX_SOURCE_LENGTH));
        }
    }

    static String truncate(String text, int maxLen) {
        return text.length() > maxLen ? text.substring(0, Math.max(0, maxLen)) : text;
    }
}
