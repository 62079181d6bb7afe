package com.openforge.agentmemory.memory;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.agentmemory.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed classification of what a memory is about.
 *
 * DECISION      - "Decided to use batching for all writes."
 * CORRECTION    - "Actually, that's wrong: the port is 6333."
 * LEARNING      - "Realized the index needs a filter field first."
 * PREFERENCE    - "I prefer short answers."
 * CONTEXT       - anything else worth keeping; the default for direct indexing.
 * USER_PROFILE  - stable facts about the subject; only ever assigned explicitly.
 *
 * On the wire and in the vector store the lower-case name is used.
 */
public enum MemoryCategory {
    DECISION,
    CORRECTION,
    LEARNING,
    PREFERENCE,
    CONTEXT,
    USER_PROFILE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MemoryCategory> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.wireName().equals(normalized))
                .findFirst();
    }

    /**
     * Strict variant of {@link #parse}: a non-blank value outside the closed set is a caller error.
     *
     * @return the category, or {@code null} when {@code value} is blank
     */
    public static MemoryCategory fromWireName(String value) {
        if (value == null || value.isBlank()) return null;
        return parse(value).orElseThrow(() -> new ValidationException(
                "Unknown category '%s'; expected one of %s".formatted(value, allowedValues())));
    }

    private static String allowedValues() {
        return Arrays.stream(values()).map(MemoryCategory::wireName).collect(Collectors.joining(", "));
    }
}
