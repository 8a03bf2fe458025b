package com.chatcoach.infrastructure.ai;

/**
 * Pair of system prompt and user message sent to a provider.
 */
public record LlmPrompt(String systemPrompt, String userMessage) {}
