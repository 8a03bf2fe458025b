package com.chatcoach.infrastructure.ai.cache;

import com.chatcoach.domain.reply.model.StagePayload;
import com.chatcoach.domain.reply.model.StageResult;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Content-addressed store of stage results, namespaced by stage kind.
 * Entries are never updated in place; {@link #invalidate(CacheKey)} is the only explicit removal.
 */
public interface StageCache {

    /**
     * @throws CacheBackendException when the backend cannot be read
     */
    Optional<StageResult<?>> get(CacheKey key);

    /**
     * @throws CacheBackendException when the backend cannot be written
     */
    void put(CacheKey key, StageResult<?> result, Duration ttl);

    void invalidate(CacheKey key);

    /**
     * Returns the cached result (marked {@code fromCache}) or runs the loader. Concurrent callers for
     * the same key share one loader run; only the first caller receives the result unmarked.
     * Completing or cancelling the returned future never affects the shared computation.
     */
    <T extends StagePayload> CompletableFuture<StageResult<T>> getOrCompute(
            CacheKey key, Duration ttl, Supplier<CompletableFuture<StageResult<T>>> loader);
}
