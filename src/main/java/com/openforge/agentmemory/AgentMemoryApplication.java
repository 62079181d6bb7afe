package com.openforge.agentmemory;

import com.openforge.agentmemory.blob.BlobStoreProperties;
import com.openforge.agentmemory.capture.CaptureProperties;
import com.openforge.agentmemory.embedding.EmbeddingProperties;
import com.openforge.agentmemory.hook.AutoMemoryProperties;
import com.openforge.agentmemory.memory.MemoryPipelineProperties;
import com.openforge.agentmemory.vector.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Register ConfigurationProperties globally so they are available
// regardless of whether the conditional Milvus beans are loaded.
@SpringBootApplication
@EnableConfigurationProperties({
        EmbeddingProperties.class,
        MilvusProperties.class,
        MemoryPipelineProperties.class,
        CaptureProperties.class,
        BlobStoreProperties.class,
        AutoMemoryProperties.class
})
public class AgentMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMemoryApplication.class, args);
    }
}
