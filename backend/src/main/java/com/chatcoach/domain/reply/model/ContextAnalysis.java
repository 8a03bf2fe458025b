package com.chatcoach.domain.reply.model;

import java.util.List;

/**
 * Summary of the conversation so far.
 *
 * @param conversationSummary  short summary of the conversation
 * @param emotionState         positive, neutral or negative
 * @param currentIntimacyLevel 0..100
 * @param riskFlags            risk markers raised by the model
 * @param conversation         the enriched conversation, in original order
 */
public record ContextAnalysis(
        String conversationSummary,
        String emotionState,
        int currentIntimacyLevel,
        List<String> riskFlags,
        List<DialogEntry> conversation
) implements StagePayload {

    public ContextAnalysis {
        riskFlags = List.copyOf(riskFlags);
        conversation = List.copyOf(conversation);
    }

    @Override
    public StageKind kind() {
        return StageKind.CONTEXT_ANALYSIS;
    }
}
