package com.chatcoach.infrastructure.ai.extraction;

import java.util.List;

/**
 * Sink for model outputs the extractor gave up on, kept for offline analysis.
 */
public interface FailedOutputStore {

    void save(FailedOutputRecord record);

    List<FailedOutputRecord> findByRequestId(String requestId);
}
