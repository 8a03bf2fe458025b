package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.QualityTier;

/**
 * Per-call options. Null model / temperature / maxTokens fall back to the provider's configuration.
 */
public record CallOptions(String model,
                          Double temperature,
                          Integer maxTokens,
                          boolean jsonResponse,
                          QualityTier quality) {

    public static CallOptions json(QualityTier quality, double temperature, int maxTokens) {
        return new CallOptions(null, temperature, maxTokens, true, quality);
    }

    public static CallOptions text(QualityTier quality, double temperature, int maxTokens) {
        return new CallOptions(null, temperature, maxTokens, false, quality);
    }
}
