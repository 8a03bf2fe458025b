package com.chatcoach.infrastructure.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes trace events as single structured lines to the {@code chatcoach.trace} logger.
 */
@Component
public class LoggingTraceCollector implements TraceCollector {

    private static final Logger TRACE = LoggerFactory.getLogger("chatcoach.trace");

    @Override
    public void record(TraceEvent event) {
        TRACE.info("type={} requestId={} stage={} provider={} durationMs={} inputTokens={} outputTokens={} fromCache={} outcome={}",
                event.type(), event.requestId(), event.stage().tag(), event.provider(),
                event.durationMs(), event.inputTokens(), event.outputTokens(),
                event.fromCache(), event.outcome());
    }
}
