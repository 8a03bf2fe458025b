package com.chatcoach.domain.reply.model;

/**
 * Outcome of one stage, either computed or served from the stage cache.
 * Never mutated after creation; {@link #asCached()} returns a copy.
 */
public record StageResult<T extends StagePayload>(
        StageKind kind,
        T payload,
        String provider,
        String model,
        long inputTokens,
        long outputTokens,
        long durationMs,
        double costUsd,
        boolean fromCache
) {

    public StageResult {
        if (!kind.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                    + " does not belong to stage " + kind);
        }
    }

    public StageResult<T> asCached() {
        if (fromCache) {
            return this;
        }
        return new StageResult<>(kind, payload, provider, model,
                inputTokens, outputTokens, durationMs, costUsd, true);
    }

    /**
     * Same payload with usage cleared. Used where one upstream call yields several results.
     */
    public StageResult<T> withoutUsage() {
        return new StageResult<>(kind, payload, provider, model, 0, 0, durationMs, 0.0, fromCache);
    }
}
