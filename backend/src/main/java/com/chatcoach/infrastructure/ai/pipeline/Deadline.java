package com.chatcoach.infrastructure.ai.pipeline;

import java.time.Duration;

/**
 * Absolute point in (monotonic) time by which a pipeline run must finish.
 */
public final class Deadline {

    private final long expiresAtNanos;
    private final Duration budget;

    private Deadline(long expiresAtNanos, Duration budget) {
        this.expiresAtNanos = expiresAtNanos;
        this.budget = budget;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime() + budget.toNanos(), budget);
    }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    /**
     * Remaining time rounded up to whole milliseconds, at least 1. A timer armed with this value
     * fires no earlier than the deadline itself.
     */
    public long remainingMillis() {
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? (left + 999_999) / 1_000_000 : 1;
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }

    public Duration budget() {
        return budget;
    }
}
