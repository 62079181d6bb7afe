package com.openforge.agentmemory.vector;

import com.openforge.agentmemory.exception.ConfigurationException;
import com.openforge.agentmemory.embedding.EmbeddingGateway;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.DescribeCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.collection.response.DescribeCollectionResp;
import io.milvus.v2.service.index.request.CreateIndexReq;
import io.milvus.v2.service.index.request.ListIndexesReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates and verifies the memory collection.
 *
 * Collection schema  (agent_memories):
 * ┌──────────────────┬─────────────────┬─────────────────────────────────────┐
 * │ Field            │ Type            │ Notes                               │
 * ├──────────────────┼─────────────────┼─────────────────────────────────────┤
 * │ id               │ VARCHAR(512) PK │ owner:source:hash, not auto-id      │
 * │ owner            │ VARCHAR(128)    │ TRIE index, equality filter         │
 * │ category         │ VARCHAR(32)     │ TRIE index, equality filter         │
 * │ source           │ VARCHAR(256)    │ file name / manual / auto-capture   │
 * │ created_at_ms    │ INT64           │ epoch millis                        │
 * │ chunk_index      │ INT64           │ position in source document         │
 * │ raw_text         │ VARCHAR(65535)  │ stored snippet                      │
 * │ embedding        │ FLOAT_VECTOR    │ dim = vector-dimensions             │
 * └──────────────────┴─────────────────┴─────────────────────────────────────┘
 *
 * Index: HNSW on embedding with the COSINE metric.
 *
 * An existing collection whose vector field has another dimensionality, or a
 * configured embedding dimensionality that differs from the collection's, is
 * a deployment error and aborts startup.
 */
@Slf4j
@Service
public class MilvusCollectionManager {

    public static final String FIELD_ID         = "id";
    public static final String FIELD_OWNER      = "owner";
    public static final String FIELD_CATEGORY   = "category";
    public static final String FIELD_SOURCE     = "source";
    public static final String FIELD_CREATED_AT = "created_at_ms";
    public static final String FIELD_CHUNK      = "chunk_index";
    public static final String FIELD_RAW_TEXT   = "raw_text";
    public static final String FIELD_EMBEDDING  = "embedding";

    public static final int MAX_ID_LENGTH       = 512;
    public static final int MAX_OWNER_LENGTH    = 128;
    public static final int MAX_SOURCE_LENGTH   = 256;
    public static final int MAX_RAW_TEXT_LENGTH = 65_535;

    /** Scalar fields the retrieval pipeline filters on; each must carry an index. */
    static final List<String> FILTER_FIELDS = List.of(FIELD_OWNER, FIELD_CATEGORY);

    @Nullable
    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;
    private final EmbeddingGateway embeddingGateway;

    public MilvusCollectionManager(@Nullable MilvusClientV2 milvusClient,
                                   MilvusProperties props,
                                   EmbeddingGateway embeddingGateway) {
        this.milvusClient     = milvusClient;
        this.props            = props;
        this.embeddingGateway = embeddingGateway;
    }

    /**
     * Makes sure the configured collection exists with the expected shape.
     * No-op (and returns false) when Milvus is not connected.
     */
    public boolean ensureCollection() {
        if (embeddingGateway.dimensions() != props.vectorDimensions()) {
            throw ConfigurationException.deployer(
                    "Embedding dimensions (%d) differ from memory.milvus.vector-dimensions (%d)"
                            .formatted(embeddingGateway.dimensions(), props.vectorDimensions()));
        }
        if (milvusClient == null) return false;

        String name = props.collectionName();
        boolean exists = milvusClient.hasCollection(
                HasCollectionReq.builder().collectionName(name).build());

        if (exists) {
            verifyDimensions(name);
            ensureFilterIndexes(name);
            log.info("[Milvus] Collection '{}' confirmed existing (dim={}).", name, props.vectorDimensions());
            return true;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})…", name, props.vectorDimensions());
        createCollection(name, props.vectorDimensions());
        return true;
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private void verifyDimensions(String name) {
        DescribeCollectionResp description = milvusClient.describeCollection(
                DescribeCollectionReq.builder().collectionName(name).build());
        CreateCollectionReq.FieldSchema vectorField = description.getCollectionSchema()
                .getFieldSchemaList().stream()
                .filter(field -> FIELD_EMBEDDING.equals(field.getName()))
                .findFirst()
                .orElse(null);
        if (vectorField == null) {
            throw ConfigurationException.deployer(
                    "Collection '%s' has no '%s' vector field".formatted(name, FIELD_EMBEDDING));
        }
        Integer actual = vectorField.getDimension();
        if (actual == null || actual != props.vectorDimensions()) {
            throw ConfigurationException.deployer(
                    "Collection '%s' stores %s-dimensional vectors, configured %d"
                            .formatted(name, actual, props.vectorDimensions()));
        }
    }

    private void ensureFilterIndexes(String name) {
        List<String> existing = milvusClient.listIndexes(
                ListIndexesReq.builder().collectionName(name).build());
        List<IndexParam> missing = new ArrayList<>();
        for (String field : FILTER_FIELDS) {
            if (!existing.contains(field)) {
                log.warn("[Milvus] Collection '{}' lacks a scalar index on '{}', creating it.", name, field);
                missing.add(scalarIndex(field));
            }
        }
        if (!missing.isEmpty()) {
            milvusClient.createIndex(CreateIndexReq.builder()
                    .collectionName(name)
                    .indexParams(missing)
                    .build());
        }
    }

    private void createCollection(String name, int dimension) {
        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder().fieldName(FIELD_ID)
                .dataType(DataType.VarChar).maxLength(MAX_ID_LENGTH)
                .isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_OWNER)
                .dataType(DataType.VarChar).maxLength(MAX_OWNER_LENGTH).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_CATEGORY)
                .dataType(DataType.VarChar).maxLength(32).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_SOURCE)
                .dataType(DataType.VarChar).maxLength(MAX_SOURCE_LENGTH).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_CREATED_AT)
                .dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_CHUNK)
                .dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_RAW_TEXT)
                .dataType(DataType.VarChar).maxLength(MAX_RAW_TEXT_LENGTH).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_EMBEDDING)
                .dataType(DataType.FloatVector).dimension(dimension).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(FIELD_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        List<IndexParam> indexes = new ArrayList<>();
        indexes.add(vectorIndex);
        FILTER_FIELDS.forEach(field -> indexes.add(scalarIndex(field)));

        milvusClient.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(indexes)
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }

    private static IndexParam scalarIndex(String field) {
        return IndexParam.builder()
                .fieldName(field)
                .indexType(IndexParam.IndexType.TRIE)
                .build();
    }
}
