package com.openforge.agentmemory.config;

import com.openforge.agentmemory.exception.ConfigurationException;
import com.openforge.agentmemory.exception.NotFoundException;
import com.openforge.agentmemory.exception.UpstreamException;
import com.openforge.agentmemory.exception.ValidationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a call against an external collaborator with a time limit and a circuit breaker.
 *
 * Call graph:
 *
 *   call(upstream, supplier)
 *     └─ circuitBreaker(upstream)
 *           └─ timeLimiter(upstream)
 *                 └─ supplier on memoryIoExecutor
 *
 * Every failure leaves as an {@link UpstreamException}, except the memory
 * layer's own {@link ValidationException} / {@link ConfigurationException} /
 * {@link UpstreamException}, which pass through unchanged.
 * Fully programmatic: no AOP proxies or annotations.
 */
@Slf4j
@Component
public class UpstreamGuard {

    public static final String EMBEDDING    = "embedding";
    public static final String VECTOR_STORE = "vectorStore";
    public static final String BLOB_STORE   = "blobStore";

    private final CircuitBreakerRegistry circuitBreakers;
    private final TimeLimiterRegistry    timeLimiters;
    private final ExecutorService        executor;

    public UpstreamGuard(CircuitBreakerRegistry circuitBreakers,
                         TimeLimiterRegistry timeLimiters,
                         ExecutorService memoryIoExecutor) {
        this.circuitBreakers = circuitBreakers;
        this.timeLimiters    = timeLimiters;
        this.executor        = memoryIoExecutor;
    }

    public <T> T call(String upstream, Supplier<T> call) {
        CircuitBreaker cb = circuitBreakers.circuitBreaker(upstream);
        TimeLimiter    tl = timeLimiters.timeLimiter(upstream);

        Callable<T> timed   = TimeLimiter.decorateFutureSupplier(tl,
                () -> CompletableFuture.supplyAsync(call, executor));
        Callable<T> guarded = CircuitBreaker.decorateCallable(cb, timed);

        try {
            return guarded.call();
        } catch (TimeoutException e) {
            throw new UpstreamException("%s call timed out after %d ms"
                    .formatted(upstream, tl.getTimeLimiterConfig().getTimeoutDuration().toMillis()), e);
        } catch (CallNotPermittedException e) {
            throw new UpstreamException(upstream + " is unavailable (circuit open)", e);
        } catch (Exception e) {
            throw translate(upstream, e);
        }
    }

    public void run(String upstream, Runnable call) {
        call(upstream, () -> {
            call.run();
            return null;
        });
    }

    private static RuntimeException translate(String upstream, Exception e) {
        Throwable cause = e;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof UpstreamException
                || cause instanceof ConfigurationException
                || cause instanceof ValidationException
                || cause instanceof NotFoundException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        log.debug("[Upstream] {} failed: {}", upstream, cause.toString());
        return new UpstreamException("%s call failed: %s".formatted(upstream, cause.getMessage()), cause);
    }
}
