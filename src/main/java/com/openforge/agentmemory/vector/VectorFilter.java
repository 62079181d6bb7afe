package com.openforge.agentmemory.vector;

import com.openforge.agentmemory.memory.MemoryCategory;
import org.springframework.lang.Nullable;

/**
 * Exact-equality metadata filter for a nearest-neighbour query.
 * A {@code null} field means "no restriction on this field".
 */
public record VectorFilter(
        @Nullable String         owner,
        @Nullable MemoryCategory category
) {

    private static final VectorFilter NONE = new VectorFilter(null, null);

    public VectorFilter {
        if (owner != null && owner.isBlank()) owner = null;
    }

    public static VectorFilter none() {
        return NONE;
    }

    public static VectorFilter owner(String owner) {
        return new VectorFilter(owner, null);
    }

    public boolean isEmpty() {
        return owner == null && category == null;
    }

    public boolean matches(String recordOwner, MemoryCategory recordCategory) {
        return (owner == null || owner.equals(recordOwner))
                && (category == null || category == recordCategory);
    }
}
