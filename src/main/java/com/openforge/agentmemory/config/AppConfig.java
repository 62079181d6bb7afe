package com.openforge.agentmemory.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - I/O executor      → runs guarded upstream calls so a TimeLimiter can abandon them
 *  - Java HttpClient   → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper → Java time as ISO-8601, tolerant deserialization
 */
@Configuration
public class AppConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService memoryIoExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "memory-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    /**
     * Single, shared HttpClient instance.
     * Connect timeout only; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient(ExecutorService memoryIoExecutor) {
        return HttpClient.newBuilder()
                .executor(memoryIoExecutor)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (the embedding API can add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
