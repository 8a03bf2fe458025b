package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.infrastructure.ai.LlmCallResult;
import com.chatcoach.infrastructure.ai.LlmPrompt;

import java.util.Set;

/**
 * Uniform contract over one LLM backend.
 *
 * <p>Implementations report failures through the {@link ProviderException} hierarchy:
 * {@link ProviderUnavailableException}, {@link ProviderRateLimitedException},
 * {@link ProviderTimeoutException} and {@link CapabilityUnsupportedException}.
 * Retrying on another backend is not the adapter's job.
 */
public interface ProviderAdapter {

    String name();

    /**
     * Lower rank is tried first.
     */
    int priority();

    Set<Capability> capabilities();

    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }

    LlmCallResult callText(LlmPrompt prompt, CallOptions options);

    LlmCallResult callVision(LlmPrompt prompt, String imageRef, CallOptions options);

    /**
     * Cost of one call in USD. Zero when the provider has no configured prices.
     */
    default double costUsd(long inputTokens, long outputTokens) {
        return 0.0;
    }
}
