package com.chatcoach.infrastructure.ai.cache;

import com.chatcoach.domain.reply.model.StageKind;

/**
 * Semantic cache key: stage kind plus a SHA-256 fingerprint of the inputs that matter to that stage.
 */
public record CacheKey(StageKind kind, String fingerprint) {

    public String storageKey() {
        return kind.tag() + ":" + fingerprint;
    }

    @Override
    public String toString() {
        return storageKey();
    }
}
