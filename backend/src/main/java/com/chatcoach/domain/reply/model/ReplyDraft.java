package com.chatcoach.domain.reply.model;

public record ReplyDraft(String text, String strategy) implements StagePayload {

    @Override
    public StageKind kind() {
        return StageKind.REPLY;
    }
}
