package com.chatcoach.infrastructure.ai.cache;

import com.chatcoach.domain.reply.model.StageKind;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hit / miss / single-flight join counters per stage kind.
 */
@Slf4j
public class CacheMetricsTracker {

    private final Map<StageKind, AtomicLong> hits = counters();
    private final Map<StageKind, AtomicLong> misses = counters();
    private final Map<StageKind, AtomicLong> joins = counters();

    public void recordHit(StageKind kind) {
        hits.get(kind).incrementAndGet();
        logRates(kind, "hit");
    }

    public void recordMiss(StageKind kind) {
        misses.get(kind).incrementAndGet();
        logRates(kind, "miss");
    }

    public void recordJoin(StageKind kind) {
        joins.get(kind).incrementAndGet();
        logRates(kind, "join");
    }

    public long getHits(StageKind kind) {
        return hits.get(kind).get();
    }

    public long getMisses(StageKind kind) {
        return misses.get(kind).get();
    }

    public long getJoins(StageKind kind) {
        return joins.get(kind).get();
    }

    /**
     * Share of lookups answered without running the loader (hits and joins), in percent.
     */
    public double getHitRate(StageKind kind) {
        long served = getHits(kind) + getJoins(kind);
        long total = served + getMisses(kind);
        return total > 0 ? (double) served / total * 100 : 0;
    }

    private void logRates(StageKind kind, String event) {
        log.debug("[StageCache] {} {} - hits={}, misses={}, joins={}, hitRate={}%",
                kind.tag(), event, getHits(kind), getMisses(kind), getJoins(kind),
                String.format("%.1f", getHitRate(kind)));
    }

    private static Map<StageKind, AtomicLong> counters() {
        Map<StageKind, AtomicLong> map = new EnumMap<>(StageKind.class);
        for (StageKind kind : StageKind.values()) {
            map.put(kind, new AtomicLong());
        }
        return map;
    }
}
