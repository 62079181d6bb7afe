package com.openforge.agentmemory.vector;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database.
 *
 * application.yml:
 *
 * memory:
 *   milvus:
 *     host: localhost
 *     port: 19530
 *     token: ""                 # user:password or API key, empty for open deployments
 *     collection-name: agent_memories
 *     vector-dimensions: 768
 *     timeout-ms: 10000         # per upsert / search / stats call
 *     consistency-level: STRONG # read-your-writes for duplicate suppression
 */
@ConfigurationProperties(prefix = "memory.milvus")
public record MilvusProperties(
        @DefaultValue("true")           boolean enabled,
        @DefaultValue("localhost")      String  host,
        @DefaultValue("19530")          int     port,
        @DefaultValue("")               String  token,
        @DefaultValue("agent_memories") String  collectionName,
        @DefaultValue("768")            int     vectorDimensions,
        @DefaultValue("10000")          long    timeoutMs,
        @DefaultValue("STRONG")         String  consistencyLevel
) {}
