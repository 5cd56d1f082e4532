package com.boundgen.infrastructure.ai.pipeline;

import com.boundgen.infrastructure.ai.GenerationServiceException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry policy for generation service calls: failures and timeouts back off exponentially,
 * cancellation is never retried.
 */
@Slf4j
@Configuration
public class GenerationRetryConfig {

    @Value("${generation.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${generation.retry.initial-backoff-ms:500}")
    private long initialBackoffMs;

    @Value("${generation.retry.multiplier:2.0}")
    private double multiplier;

    @Bean
    public Retry generationRetry() {
        Retry retry = Retry.of("generation", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), multiplier))
                .retryOnException(GenerationRetryConfig::isRetryable)
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("Generation call retry #{} after {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
        return retry;
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof GenerationServiceException e && e.isRetryable();
    }
}
