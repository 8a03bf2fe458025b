package com.chatcoach.domain.reply.model;

import java.util.List;

/**
 * Relationship state and recommended scenario for the next reply.
 */
public record SceneAnalysis(
        String relationshipState,
        String currentScenario,
        String recommendedScenario,
        int intimacyLevel,
        List<String> riskFlags,
        List<String> recommendedStrategies
) implements StagePayload {

    public SceneAnalysis {
        riskFlags = List.copyOf(riskFlags);
        recommendedStrategies = List.copyOf(recommendedStrategies);
    }

    @Override
    public StageKind kind() {
        return StageKind.SCENE_ANALYSIS;
    }
}
