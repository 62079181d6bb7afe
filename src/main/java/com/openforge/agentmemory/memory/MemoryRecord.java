package com.openforge.agentmemory.memory;

import java.time.Instant;
import java.util.List;

/**
 * The unit of persistence in the vector store.
 *
 * {@code id} is derived from (owner, source, rawText-before-truncation) by
 * {@link MemoryIdGenerator}, so upserting the same content twice overwrites
 * the same record.
 */
public record MemoryRecord(
        String         id,
        List<Float>    vector,
        String         owner,
        MemoryCategory category,
        String         source,
        Instant        createdAt,
        int            chunkIndex,
        String         rawText
) {

    public MemoryRecord {
        vector = List.copyOf(vector);
    }

    public MemoryMetadata metadata() {
        return new MemoryMetadata(owner, category, source, createdAt, chunkIndex, rawText);
    }
}
