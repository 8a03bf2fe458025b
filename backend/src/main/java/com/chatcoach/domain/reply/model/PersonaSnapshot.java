package com.chatcoach.domain.reply.model;

/**
 * Inferred speaking style of the user the reply is written for.
 */
public record PersonaSnapshot(
        String pacing,
        String riskTolerance,
        double confidence,
        String stylePrompt
) implements StagePayload {

    @Override
    public StageKind kind() {
        return StageKind.PERSONA_ANALYSIS;
    }
}
