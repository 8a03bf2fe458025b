package com.chatcoach.infrastructure.ai.cache;

import com.chatcoach.domain.reply.model.StagePayload;
import com.chatcoach.domain.reply.model.StageResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Caffeine-backed stage cache with a per-entry TTL and single-flight loading.
 */
@Slf4j
public class CaffeineStageCache implements StageCache {

    private record Entry(StageResult<?> result, long ttlNanos) {}

    private final Cache<String, Entry> cache;
    private final ConcurrentHashMap<String, CompletableFuture<StageResult<?>>> inflight = new ConcurrentHashMap<>();
    private final CacheMetricsTracker metrics;

    public CaffeineStageCache(long maximumSize, CacheMetricsTracker metrics) {
        this(maximumSize, Ticker.systemTicker(), metrics);
    }

    public CaffeineStageCache(long maximumSize, Ticker ticker, CacheMetricsTracker metrics) {
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<StageResult<?>> get(CacheKey key) {
        try {
            Entry entry = cache.getIfPresent(key.storageKey());
            return entry == null ? Optional.empty() : Optional.of(entry.result());
        } catch (RuntimeException e) {
            throw new CacheBackendException("Stage cache read failed for " + key, e);
        }
    }

    @Override
    public void put(CacheKey key, StageResult<?> result, Duration ttl) {
        if (result.kind() != key.kind()) {
            throw new IllegalArgumentException("Result " + result.kind() + " stored under " + key.kind() + " key");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        try {
            cache.put(key.storageKey(), new Entry(result, ttl.toNanos()));
        } catch (RuntimeException e) {
            throw new CacheBackendException("Stage cache write failed for " + key, e);
        }
    }

    @Override
    public void invalidate(CacheKey key) {
        cache.invalidate(key.storageKey());
    }

    @Override
    public <T extends StagePayload> CompletableFuture<StageResult<T>> getOrCompute(
            CacheKey key, Duration ttl, Supplier<CompletableFuture<StageResult<T>>> loader) {
        Optional<StageResult<?>> hit = readQuietly(key);
        if (hit.isPresent()) {
            metrics.recordHit(key.kind());
            return CompletableFuture.completedFuture(cast(hit.get().asCached()));
        }

        String storageKey = key.storageKey();
        CompletableFuture<StageResult<?>> promise = new CompletableFuture<>();
        CompletableFuture<StageResult<?>> existing = inflight.putIfAbsent(storageKey, promise);
        if (existing != null) {
            metrics.recordJoin(key.kind());
            log.debug("[StageCache] Joining in-flight computation for {}", key);
            return existing.thenApply(result -> cast(result.asCached()));
        }

        // Another leader may have stored the result between the first read and registration.
        Optional<StageResult<?>> stored = readQuietly(key);
        if (stored.isPresent()) {
            inflight.remove(storageKey, promise);
            promise.complete(stored.get());
            metrics.recordHit(key.kind());
            return CompletableFuture.completedFuture(cast(stored.get().asCached()));
        }

        metrics.recordMiss(key.kind());
        CompletableFuture<StageResult<T>> computation;
        try {
            computation = loader.get();
        } catch (RuntimeException e) {
            computation = CompletableFuture.failedFuture(e);
        }
        computation.whenComplete((result, error) -> {
            if (error == null) {
                writeQuietly(key, result, ttl);
            }
            inflight.remove(storageKey, promise);
            if (error == null) {
                promise.complete(result);
            } else {
                promise.completeExceptionally(error);
            }
        });
        return promise.thenApply(CaffeineStageCache::cast);
    }

    private Optional<StageResult<?>> readQuietly(CacheKey key) {
        try {
            return get(key);
        } catch (CacheBackendException e) {
            log.warn("[StageCache] Read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeQuietly(CacheKey key, StageResult<?> result, Duration ttl) {
        try {
            put(key, result, ttl);
        } catch (RuntimeException e) {
            log.warn("[StageCache] Write failed for {}, result not cached: {}", key, e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends StagePayload> StageResult<T> cast(StageResult<?> result) {
        return (StageResult<T>) result;
    }
}
