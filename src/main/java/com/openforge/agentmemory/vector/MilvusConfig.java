package com.openforge.agentmemory.vector;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Milvus client bean.
 *
 * An unreachable Milvus does not stop the service from starting: the bean is
 * {@code null}, {@link MilvusVectorStore} reports every call as an upstream
 * failure, and /health keeps answering. Collection bootstrap (schema, indexes,
 * dimensionality check) happens in {@link MilvusCollectionManager}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "memory.milvus.enabled", havingValue = "true", matchIfMissing = true)
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            ConnectConfig.ConnectConfigBuilder config = ConnectConfig.builder()
                    .uri("http://%s:%d".formatted(props.host(), props.port()))
                    .connectTimeoutMs(15_000);
            if (props.token() != null && !props.token().isBlank()) {
                config.token(props.token());
            }
            MilvusClientV2 client = new MilvusClientV2(config.build());
            log.info("[Milvus] Connected successfully.");
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed; memory reads and writes will fail until restart. " +
                     "Cause: {}. To run without a vector store set memory.milvus.enabled=false.",
                    e.getMessage());
            return null;
        }
    }
}
