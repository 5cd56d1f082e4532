package com.boundgen.infrastructure.ai;

/**
 * Raw completion content with token usage.
 */
public record LlmCallResult(String content, long promptTokens, long completionTokens) {}
