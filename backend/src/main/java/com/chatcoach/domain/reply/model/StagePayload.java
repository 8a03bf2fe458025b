package com.chatcoach.domain.reply.model;

/**
 * Typed result of one stage. Implementations are immutable records.
 */
public interface StagePayload {

    StageKind kind();
}
