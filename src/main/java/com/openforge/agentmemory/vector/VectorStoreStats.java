package com.openforge.agentmemory.vector;

import org.springframework.lang.Nullable;

/**
 * Introspection data of the backing collection.
 *
 * @param approximateCount entity count as reported by the store; may lag recent
 *                         writes and is {@code null} when the store cannot tell
 */
public record VectorStoreStats(
        String         collection,
        int            dimensions,
        String         metric,
        @Nullable Long approximateCount
) {}
