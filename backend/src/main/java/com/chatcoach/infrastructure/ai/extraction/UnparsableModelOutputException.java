package com.chatcoach.infrastructure.ai.extraction;

import lombok.Getter;

/**
 * Model output that no repair step could turn into the expected JSON shape.
 */
@Getter
public class UnparsableModelOutputException extends RuntimeException {

    private final String rawText;
    private final RepairStep abandonedAt;
    private final String excerpt;

    public UnparsableModelOutputException(String message, String rawText, RepairStep abandonedAt, String excerpt) {
        super(message);
        this.rawText = rawText;
        this.abandonedAt = abandonedAt;
        this.excerpt = excerpt;
    }

    public UnparsableModelOutputException(String message, String rawText, RepairStep abandonedAt,
                                          String excerpt, Throwable cause) {
        super(message, cause);
        this.rawText = rawText;
        this.abandonedAt = abandonedAt;
        this.excerpt = excerpt;
    }
}
