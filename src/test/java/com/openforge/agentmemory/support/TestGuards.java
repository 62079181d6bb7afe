package com.openforge.agentmemory.support;

import com.openforge.agentmemory.config.Resilience4jConfig;
import com.openforge.agentmemory.config.UpstreamGuard;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Real {@link UpstreamGuard} instances with the production breakers and a generous time limit. */
public final class TestGuards {

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "test-io");
        t.setDaemon(true);
        return t;
    });

    private TestGuards() {}

    public static UpstreamGuard guard() {
        return guard(Duration.ofSeconds(5));
    }

    public static UpstreamGuard guard(Duration timeout) {
        TimeLimiterRegistry timeLimiters = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        return new UpstreamGuard(new Resilience4jConfig().circuitBreakerRegistry(), timeLimiters, EXECUTOR);
    }
}
