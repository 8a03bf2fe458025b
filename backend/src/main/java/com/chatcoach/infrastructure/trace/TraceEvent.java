package com.chatcoach.infrastructure.trace;

import com.chatcoach.domain.reply.model.StageKind;

/**
 * One provider attempt or one stage completion.
 *
 * @param requestId    originating request
 * @param stage        stage the event belongs to
 * @param provider     provider id, or "cache" for cache hits
 * @param durationMs   wall-clock duration
 * @param inputTokens  prompt tokens reported by the provider
 * @param outputTokens completion tokens reported by the provider
 * @param fromCache    whether the stage result was served from the stage cache
 * @param outcome      "success", "cache_hit" or the error kind
 */
public record TraceEvent(
        String requestId,
        Type type,
        StageKind stage,
        String provider,
        long durationMs,
        long inputTokens,
        long outputTokens,
        boolean fromCache,
        String outcome
) {

    public enum Type {
        PROVIDER_ATTEMPT,
        STAGE_COMPLETED
    }
}
