package com.chatcoach.infrastructure.ai.extraction;

import java.time.Instant;

/**
 * One persisted extraction failure.
 */
public record FailedOutputRecord(
        Instant timestamp,
        String requestId,
        String rawTextTruncated,
        int rawTextLength,
        String parseError
) {

    static final int MAX_STORED_TEXT = 500;

    public static FailedOutputRecord of(String requestId, String rawText, String parseError) {
        String text = rawText == null ? "" : rawText;
        String truncated = text.length() > MAX_STORED_TEXT ? text.substring(0, MAX_STORED_TEXT) : text;
        return new FailedOutputRecord(Instant.now(), requestId, truncated, text.length(), parseError);
    }
}
