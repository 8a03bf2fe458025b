package com.chatcoach.domain.reply.model;

/**
 * Pipeline stages. Each kind has a fixed payload type and its own cache namespace.
 */
public enum StageKind {
    CONTEXT_ANALYSIS("context_analysis", ContextAnalysis.class),
    SCENE_ANALYSIS("scene_analysis", SceneAnalysis.class),
    PERSONA_ANALYSIS("persona_analysis", PersonaSnapshot.class),
    IMAGE_RESULT("image_result", ImageAnalysis.class),
    REPLY("reply", ReplyDraft.class);

    private final String tag;
    private final Class<? extends StagePayload> payloadType;

    StageKind(String tag, Class<? extends StagePayload> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    public String tag() {
        return tag;
    }

    public Class<? extends StagePayload> payloadType() {
        return payloadType;
    }
}
