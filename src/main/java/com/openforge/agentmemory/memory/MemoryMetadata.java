package com.openforge.agentmemory.memory;

import java.time.Instant;

/**
 * The filterable / displayable part of a stored memory: everything except id and vector.
 *
 * @param owner      agent or subject the memory belongs to
 * @param category   closed-set classification
 * @param source     provenance: a file name, "manual" or "auto-capture"
 * @param createdAt  write time, never mutated
 * @param chunkIndex position within the source document, 0 when atomic
 * @param rawText    the indexed text, possibly truncated for storage
 */
public record MemoryMetadata(
        String         owner,
        MemoryCategory category,
        String         source,
        Instant        createdAt,
        int            chunkIndex,
        String         rawText
) {}
