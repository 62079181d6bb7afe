package com.openforge.agentmemory.vector;

import com.openforge.agentmemory.memory.MemoryMatch;
import com.openforge.agentmemory.memory.MemoryRecord;

import java.util.List;

/**
 * Narrow capability interface over the external vector index.
 *
 * Implementations throw {@link com.openforge.agentmemory.exception.UpstreamException}
 * for any store-side failure, including a filtered query on a field that has no
 * scalar index. A store never falls back to an unfiltered scan.
 */
public interface VectorStore {

    /**
     * Insert-or-overwrite by {@link MemoryRecord#id()}.
     * Either every record of the call is accepted or the call fails.
     */
    void upsert(List<MemoryRecord> records);

    /**
     * Up to {@code topK} nearest records under cosine similarity, restricted by
     * {@code filter}, in descending score order.
     */
    List<MemoryMatch> query(List<Float> vector, VectorFilter filter, int topK);

    VectorStoreStats stats();
}
