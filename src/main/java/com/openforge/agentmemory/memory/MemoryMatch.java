package com.openforge.agentmemory.memory;

/**
 * One recall hit: a reference to a stored memory plus its cosine similarity to the query.
 */
public record MemoryMatch(
        String         id,
        double         score,
        MemoryMetadata metadata
) {}
