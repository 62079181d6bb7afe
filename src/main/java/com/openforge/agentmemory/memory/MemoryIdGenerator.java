package com.openforge.agentmemory.memory;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic record ids: {@code owner:source:hash(text)}.
 *
 * The hash is 64-bit FNV-1a over the UTF-8 bytes, printed as 16 hex digits.
 * It only has to make accidental collisions unlikely, so a fast
 * non-cryptographic hash is enough. Owner and source stay readable in the id,
 * which namespaces it: the same text under another owner or another source is
 * a different memory.
 */
@Component
public class MemoryIdGenerator {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME        = 0x100000001b3L;

    public String identity(String owner, String source, String text) {
        return owner + ":" + source + ":" + contentHash(text);
    }

    public static String contentHash(String text) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : (text == null ? "" : text).getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return String.format("%016x", hash);
    }
}
