package com.openforge.agentmemory.config;

import com.openforge.agentmemory.blob.BlobStoreProperties;
import com.openforge.agentmemory.capture.CaptureProperties;
import com.openforge.agentmemory.embedding.EmbeddingProperties;
import com.openforge.agentmemory.hook.AutoMemoryProperties;
import com.openforge.agentmemory.memory.MemoryPipelineProperties;
import com.openforge.agentmemory.vector.MilvusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Reported:
 *   - Vector store: Milvus address and collection (connection state is logged by MilvusConfig)
 *   - Embedding: model, dimensions, endpoint (API key is masked)
 *   - Pipelines: chunking, recall and capture thresholds
 *   - Blob buckets: root directory and owner mappings
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final EmbeddingProperties      embeddingProperties;
    private final MilvusProperties         milvusProperties;
    private final MemoryPipelineProperties pipelineProperties;
    private final CaptureProperties        captureProperties;
    private final AutoMemoryProperties     autoProperties;
    private final BlobStoreProperties      blobProperties;
    private final Environment              env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            Agent Memory  -  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Vector DB (Milvus)                                      ║
                ║    Enabled        : {}
                ║    Address        : {}:{}
                ║    Collection     : {}  dim={}  consistency={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Embedding                                               ║
                ║    Model          : {}  dim={}
                ║    Endpoint       : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Pipelines                                               ║
                ║    Chunking       : max={} chars  batch={}
                ║    Query          : topK={}  minScore={}
                ║    Capture        : {}..{} chars  dedup={}@{}
                ║    Hooks          : recall={} (limit={} minScore={})  capture={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Blob Store                                              ║
                ║    Root           : {}  buckets={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                milvusProperties.enabled(),
                milvusProperties.host(), milvusProperties.port(),
                milvusProperties.collectionName(), milvusProperties.vectorDimensions(),
                milvusProperties.consistencyLevel(),

                embeddingProperties.model(), embeddingProperties.dimensions(),
                embeddingProperties.baseUrl(), maskKey(embeddingProperties.apiKey()),

                pipelineProperties.maxChunkSize(), pipelineProperties.effectiveBatchSize(),
                pipelineProperties.defaultTopK(), pipelineProperties.defaultMinScore(),
                captureProperties.minLength(), captureProperties.maxLength(),
                captureProperties.duplicateCheck(), captureProperties.duplicateThreshold(),
                autoProperties.autoRecall(), autoProperties.recallLimit(), autoProperties.minRecallScore(),
                autoProperties.autoCapture(),

                blobProperties.root(), blobProperties.buckets().size()
        );
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key is empty or a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
