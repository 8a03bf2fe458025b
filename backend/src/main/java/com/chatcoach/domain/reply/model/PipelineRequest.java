package com.chatcoach.domain.reply.model;

import java.util.List;

/**
 * Input of one reply generation. Read-only once created.
 *
 * @param requestId      caller supplied id, used for trace and failed-output records
 * @param userId         the user the reply is written for
 * @param targetId       the other participant
 * @param conversationId conversation / session id
 * @param dialogs        conversation history, order is significant
 * @param language       reply language (e.g. "en")
 * @param quality        quality tier
 * @param imageRef       optional screenshot URL (nullable)
 * @param strategy       optional flow strategy (nullable, configured default applies)
 */
public record PipelineRequest(
        String requestId,
        String userId,
        String targetId,
        String conversationId,
        List<DialogEntry> dialogs,
        String language,
        QualityTier quality,
        String imageRef,
        FlowStrategy strategy
) {

    public PipelineRequest {
        dialogs = dialogs == null ? List.of() : List.copyOf(dialogs);
    }

    public boolean hasImage() {
        return imageRef != null && !imageRef.isBlank();
    }

    public List<String> participantIds() {
        return List.of(userId, targetId == null ? "" : targetId);
    }

    public PipelineRequest withStrategy(FlowStrategy newStrategy) {
        return new PipelineRequest(requestId, userId, targetId, conversationId, dialogs,
                language, quality, imageRef, newStrategy);
    }
}
