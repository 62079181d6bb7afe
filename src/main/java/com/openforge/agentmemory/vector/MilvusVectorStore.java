package com.openforge.agentmemory.vector;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.agentmemory.exception.UpstreamException;
import com.openforge.agentmemory.memory.MemoryCategory;
import com.openforge.agentmemory.memory.MemoryMatch;
import com.openforge.agentmemory.memory.MemoryMetadata;
import com.openforge.agentmemory.memory.MemoryRecord;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.ConsistencyLevel;
import io.milvus.v2.service.collection.request.GetCollectionStatsReq;
import io.milvus.v2.service.collection.response.GetCollectionStatsResp;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import io.milvus.v2.service.vector.response.UpsertResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.openforge.agentmemory.vector.MilvusCollectionManager.*;

/**
 * {@link VectorStore} backed by a single Milvus collection.
 *
 *   upsert() - primary key is the deterministic memory id, so re-indexing is idempotent
 *   query()  - ANN search with a boolean filter over the owner / category scalar indexes
 *   stats()  - collection statistics; the entity count is approximate
 */
@Slf4j
@Service
public class MilvusVectorStore implements VectorStore {

    static final String METRIC = "cosine";

    private static final List<String> OUTPUT_FIELDS = List.of(
            FIELD_ID, FIELD_OWNER, FIELD_CATEGORY, FIELD_SOURCE, FIELD_CREATED_AT, FIELD_CHUNK, FIELD_RAW_TEXT);

    /** May be null when memory.milvus.enabled=false or Milvus is unreachable. */
    @Nullable
    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;
    private final ConsistencyLevel consistencyLevel;

    public MilvusVectorStore(@Nullable MilvusClientV2 milvusClient,
                             MilvusProperties props,
                             MilvusCollectionManager collectionManager) {
        this.milvusClient     = milvusClient;
        this.props            = props;
        this.consistencyLevel = parseConsistency(props.consistencyLevel());
        if (!collectionManager.ensureCollection()) {
            log.warn("[Milvus] Vector store is not available; index and query calls will fail.");
        }
    }

    // ── Upsert ───────────────────────────────────────────────────────────────

    @Override
    public void upsert(List<MemoryRecord> records) {
        if (records.isEmpty()) return;
        MilvusClientV2 client = connectedClient();

        List<JsonObject> rows = new ArrayList<>(records.size());
        for (MemoryRecord record : records) {
            rows.add(toRow(record));
        }

        UpsertResp resp = client.upsert(UpsertReq.builder()
                .collectionName(props.collectionName())
                .data(rows)
                .build());

        long accepted = resp == null ? 0 : resp.getUpsertCnt();
        if (accepted < rows.size()) {
            throw new UpstreamException("Milvus accepted %d of %d records in upsert batch"
                    .formatted(accepted, rows.size()));
        }
        log.debug("[Milvus] Upserted {} records into '{}'", rows.size(), props.collectionName());
    }

    // ── Query ────────────────────────────────────────────────────────────────

    @Override
    public List<MemoryMatch> query(List<Float> vector, VectorFilter filter, int topK) {
        MilvusClientV2 client = connectedClient();

        SearchReq.SearchReqBuilder builder = SearchReq.builder()
                .collectionName(props.collectionName())
                .data(List.of(new FloatVec(vector)))
                .annsField(FIELD_EMBEDDING)
                .topK(topK)
                .outputFields(OUTPUT_FIELDS)
                .consistencyLevel(consistencyLevel);

        String expression = filterExpression(filter);
        if (expression != null) builder.filter(expression);

        SearchResp resp = client.search(builder.build());

        List<MemoryMatch> results = new ArrayList<>();
        if (resp == null || resp.getSearchResults() == null) return results;

        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                Float scoreF = hit.getScore();
                double score = scoreF == null ? 0.0 : scoreF.doubleValue();
                Map<String, Object> e = hit.getEntity();
                String id = hit.getId() != null ? hit.getId().toString() : str(e, FIELD_ID);
                results.add(new MemoryMatch(id, score, toMetadata(e)));
            }
        }
        return results;
    }

    // ── Stats ────────────────────────────────────────────────────────────────

    @Override
    public VectorStoreStats stats() {
        MilvusClientV2 client = connectedClient();
        GetCollectionStatsResp resp = client.getCollectionStats(GetCollectionStatsReq.builder()
                .collectionName(props.collectionName())
                .build());
        Long count = resp == null ? null : resp.getNumOfEntities();
        return new VectorStoreStats(props.collectionName(), props.vectorDimensions(), METRIC, count);
    }

    // ── Filter expressions ───────────────────────────────────────────────────

    /**
     * Equality-only Milvus boolean expression, or {@code null} for no filter.
     * e.g. {@code owner == "dev" and category == "decision"}
     */
    static String filterExpression(VectorFilter filter) {
        List<String> parts = new ArrayList<>();
        if (filter.owner() != null)
            parts.add("%s == \"%s\"".formatted(FIELD_OWNER, escape(filter.owner())));
        if (filter.category() != null)
            parts.add("%s == \"%s\"".formatted(FIELD_CATEGORY, filter.category().wireName()));
        return parts.isEmpty() ? null : String.join(" and ", parts);
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private MilvusClientV2 connectedClient() {
        if (milvusClient == null) {
            throw new UpstreamException("Vector store is not connected");
        }
        return milvusClient;
    }

    private static JsonObject toRow(MemoryRecord record) {
        JsonObject row = new JsonObject();
        row.addProperty(FIELD_ID,         record.id());
        row.addProperty(FIELD_OWNER,      record.owner());
        row.addProperty(FIELD_CATEGORY,   record.category().wireName());
        row.addProperty(FIELD_SOURCE,     record.source());
        row.addProperty(FIELD_CREATED_AT, record.createdAt().toEpochMilli());
        row.addProperty(FIELD_CHUNK,      (long) record.chunkIndex());
        row.addProperty(FIELD_RAW_TEXT,   record.rawText());

        JsonArray embeddingArray = new JsonArray();
        for (Float f : record.vector()) embeddingArray.add(f);
        row.add(FIELD_EMBEDDING, embeddingArray);
        return row;
    }

    private static MemoryMetadata toMetadata(Map<String, Object> e) {
        return new MemoryMetadata(
                str(e, FIELD_OWNER),
                MemoryCategory.parse(str(e, FIELD_CATEGORY)).orElse(MemoryCategory.CONTEXT),
                str(e, FIELD_SOURCE),
                Instant.ofEpochMilli(num(e, FIELD_CREATED_AT)),
                (int) num(e, FIELD_CHUNK),
                str(e, FIELD_RAW_TEXT));
    }

    private static String str(Map<String, Object> e, String key) {
        Object value = e == null ? null : e.get(key);
        return value == null ? "" : value.toString();
    }

    private static long num(Map<String, Object> e, String key) {
        Object value = e == null ? null : e.get(key);
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static ConsistencyLevel parseConsistency(String value) {
        try {
            return ConsistencyLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            log.warn("[Milvus] Unknown consistency level '{}', using BOUNDED", value);
            return ConsistencyLevel.BOUNDED;
        }
    }
}
