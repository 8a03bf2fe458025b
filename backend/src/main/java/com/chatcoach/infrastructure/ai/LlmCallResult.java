package com.chatcoach.infrastructure.ai;

/**
 * Result of an LLM API call including token usage for cost tracking.
 */
public record LlmCallResult(String content, String provider, String model,
                            long promptTokens, long completionTokens) {}
