package com.openforge.agentmemory.blob;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;
import java.util.Optional;

/**
 * Source-file storage used by bulk ingestion.
 *
 * application.yml:
 *
 * memory:
 *   blob:
 *     root: /var/lib/agent-memory/buckets
 *     timeout-ms: 5000
 *     buckets:          # owner → bucket
 *       dev: dev-memory
 *       flo: flo-memory
 */
@ConfigurationProperties(prefix = "memory.blob")
public record BlobStoreProperties(
        @DefaultValue("./buckets") String root,
        @DefaultValue("5000")      long   timeoutMs,
        Map<String, String>               buckets
) {

    public BlobStoreProperties {
        buckets = buckets == null ? Map.of() : Map.copyOf(buckets);
    }

    public Optional<String> bucketFor(String owner) {
        return Optional.ofNullable(owner).map(buckets::get);
    }
}
