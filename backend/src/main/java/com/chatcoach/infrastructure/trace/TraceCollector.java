package com.chatcoach.infrastructure.trace;

/**
 * Sink for timing/outcome events. Implementations must not throw.
 */
public interface TraceCollector {

    void record(TraceEvent event);
}
