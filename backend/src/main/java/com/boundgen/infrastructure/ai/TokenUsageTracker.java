package com.boundgen.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative token accounting across all model calls, reported through the log.
 */
@Slf4j
@Component
public class TokenUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();
    private final AtomicLong totalCachedTokens = new AtomicLong();

    public void recordUsage(String caller, long promptTokens, long completionTokens, long cachedTokens) {
        long requests = totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);
        totalCachedTokens.addAndGet(cachedTokens);

        log.info("Token usage [{}] - request #{}: prompt={}, completion={}, cached={}, cumulative prompt={}, completion={}, cacheRate={}%",
                caller, requests, promptTokens, completionTokens, cachedTokens,
                totalPromptTokens.get(), totalCompletionTokens.get(), String.format("%.1f", tokenCacheRate()));
    }

    /** Cached share of all prompt tokens so far, in percent. */
    double tokenCacheRate() {
        long total = totalPromptTokens.get();
        return total > 0 ? (double) totalCachedTokens.get() / total * 100 : 0;
    }
}
