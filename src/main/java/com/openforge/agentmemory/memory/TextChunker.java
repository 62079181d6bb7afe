package com.openforge.agentmemory.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a text body into paragraph-respecting chunks.
 *
 * Paragraphs (separated by one or more blank lines) are packed greedily:
 * a paragraph joins the current chunk unless that would push the chunk past
 * {@code maxChunkSize}, in which case the chunk is closed and the paragraph
 * opens the next one. A paragraph longer than the limit is never split; it
 * becomes an oversized chunk of its own.
 *
 * Paragraphs are trimmed and rejoined with {@link #PARAGRAPH_SEPARATOR}, so
 * joining the output with the same separator gives back the input's
 * paragraphs in order. Stateless and total: blank input yields no chunks.
 */
@Component
public class TextChunker {

    public static final String PARAGRAPH_SEPARATOR = "\n\n";

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n\\s*");

    private final int defaultMaxChunkSize;

    public TextChunker(MemoryPipelineProperties properties) {
        this.defaultMaxChunkSize = Math.max(1, properties.maxChunkSize());
    }

    public List<String> chunk(String text) {
        return chunk(text, defaultMaxChunkSize);
    }

    public List<String> chunk(String text, int maxChunkSize) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) return chunks;

        int limit = Math.max(1, maxChunkSize);
        StringBuilder current = new StringBuilder();

        for (String paragraph : paragraphs(text)) {
            if (current.length() == 0) {
                current.append(paragraph);
            } else if (current.length() + PARAGRAPH_SEPARATOR.length() + paragraph.length() > limit) {
                chunks.add(current.toString());
                current.setLength(0);
                current.append(paragraph);
            } else {
                current.append(PARAGRAPH_SEPARATOR).append(paragraph);
            }
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        return chunks;
    }

    /** Non-blank, trimmed paragraphs in input order. */
    public static List<String> paragraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        if (text == null) return paragraphs;
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        for (String raw : PARAGRAPH_BREAK.split(normalized)) {
            String paragraph = raw.strip();
            if (!paragraph.isEmpty()) paragraphs.add(paragraph);
        }
        return paragraphs;
    }
}
