package com.openforge.agentmemory.config;

import com.openforge.agentmemory.blob.BlobStoreProperties;
import com.openforge.agentmemory.embedding.EmbeddingProperties;
import com.openforge.agentmemory.exception.ConfigurationException;
import com.openforge.agentmemory.exception.NotFoundException;
import com.openforge.agentmemory.exception.ValidationException;
import com.openforge.agentmemory.vector.MilvusProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring, one named instance per external collaborator:
 *   • "embedding"   - the embedding endpoint
 *   • "vectorStore" - Milvus upsert / search / stats
 *   • "blobStore"   - source-file reads for bulk ingestion
 *
 * Time limiters bound every call; circuit breakers fail fast while an upstream
 * is down. No Retry instance: retrying is left to the caller.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 20 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // bad input says nothing about the upstream's health
                .ignoreException(Resilience4jConfig::isCallerFault)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(UpstreamGuard.EMBEDDING);
        registry.circuitBreaker(UpstreamGuard.VECTOR_STORE);
        registry.circuitBreaker(UpstreamGuard.BLOB_STORE);
        return registry;
    }

    /**
     * Errors caused by the request rather than the upstream. They pass through the
     * breaker without being recorded as failures.
     */
    static boolean isCallerFault(Throwable t) {
        return t instanceof ValidationException
                || t instanceof NotFoundException
                || (t instanceof ConfigurationException c && c.getFault() == ConfigurationException.Fault.CALLER);
    }

    // ── Time Limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(EmbeddingProperties embeddingProperties,
                                                   MilvusProperties milvusProperties,
                                                   BlobStoreProperties blobStoreProperties) {
        TimeLimiterRegistry registry = TimeLimiterRegistry.ofDefaults();
        // the HTTP read timeout fires first; the limiter is the backstop
        registry.timeLimiter(UpstreamGuard.EMBEDDING,
                limit(Duration.ofSeconds(embeddingProperties.timeoutSeconds()).plusSeconds(1)));
        registry.timeLimiter(UpstreamGuard.VECTOR_STORE,
                limit(Duration.ofMillis(milvusProperties.timeoutMs())));
        registry.timeLimiter(UpstreamGuard.BLOB_STORE,
                limit(Duration.ofMillis(blobStoreProperties.timeoutMs())));
        return registry;
    }

    private static TimeLimiterConfig limit(Duration timeout) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build();
    }
}
