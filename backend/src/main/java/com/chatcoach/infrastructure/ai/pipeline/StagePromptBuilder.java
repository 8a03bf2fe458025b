package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.PersonaSnapshot;
import com.chatcoach.domain.reply.model.QualityTier;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.chatcoach.infrastructure.ai.LlmPrompt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Fixed in-code prompts for every stage. Each JSON prompt names the exact fields
 * {@link com.chatcoach.infrastructure.ai.extraction.StagePayloadMapper} reads.
 */
@Component
public class StagePromptBuilder {

    static final Map<QualityTier, String> TIER_GUIDANCE = Map.of(
            QualityTier.CHEAP, "Keep the reply short and simple.",
            QualityTier.NORMAL, "Write a natural reply of one to three sentences.",
            QualityTier.PREMIUM, "Write a carefully tailored reply that picks up details from the conversation."
    );

    // ===== Screenshot and inline images =====

    private static final String SCREENSHOT_SYSTEM_PROMPT = """
            You read chat screenshots. List every message bubble from top to bottom.
            Bubbles on the right side were sent by the user, bubbles on the left by the other participant.
            Output JSON only:
            {
              "dialogs": [{"speaker": "user|talker", "text": "...", "from_user": true}],
              "scenario": "one short phrase describing the situation"
            }""";

    private static final String IMAGE_DESCRIPTION_SYSTEM_PROMPT = """
            Describe the image sent in a chat conversation in one sentence.
            Output the description only, without any preface.""";

    // ===== Analysis =====

    private static final String CONTEXT_SYSTEM_PROMPT = """
            You are a conversation scenario analyst.
            Classify the conversation and output JSON only:
            {
              "conversation_summary": "summary",
              "emotion_state": "positive|neutral|negative",
              "current_intimacy_level": 0-100,
              "risk_flags": ["..."]
            }""";

    private static final String SCENE_SYSTEM_PROMPT = """
            You are a dating conversation strategist.
            Decide the relationship state and the scenario for the next reply. Output JSON only:
            {
              "relationship_state": "ignition|propulsion|ventilation|equilibrium",
              "current_scenario": "short description",
              "recommended_scenario": "SAFE|BALANCED|RISKY|RECOVERY|NEGATIVE",
              "intimacy_level": 0-100,
              "risk_flags": ["..."],
              "recommended_strategies": ["..."]
            }""";

    private static final String MERGED_SYSTEM_PROMPT = """
            You are a conversation analyst and dating conversation strategist.
            Analyse the conversation and decide the scenario in a single pass. Output JSON only:
            {
              "conversation_analysis": {
                "conversation_summary": "summary",
                "emotion_state": "positive|neutral|negative",
                "current_intimacy_level": 0-100,
                "risk_flags": ["..."]
              },
              "scenario_decision": {
                "relationship_state": "ignition|propulsion|ventilation|equilibrium",
                "current_scenario": "short description",
                "recommended_scenario": "SAFE|BALANCED|RISKY|RECOVERY|NEGATIVE",
                "intimacy_level": 0-100,
                "risk_flags": ["..."],
                "recommended_strategies": ["..."]
              }
            }""";

    private static final String PERSONA_SYSTEM_PROMPT = """
            You are a user profiling assistant. Infer how the user writes from their own messages.
            Output JSON only:
            {
              "pacing": "slow|normal|fast",
              "risk_tolerance": "low|medium|high",
              "confidence": 0.0-1.0,
              "prompt": "two sentences describing the user's style, usable as writing guidance"
            }""";

    // ===== Reply =====

    private static final String REPLY_SYSTEM_PROMPT = """
            You are a professional dating conversation coach. Write the user's next message.
            Constraints:
            1. Safety rules have the highest priority.
            2. Match the scenario, the intimacy level and the user's style.
            3. Prefer the recommended strategies.
            4. Advance the conversation naturally, avoid excessive enthusiasm or coldness.
            Output JSON only:
            {"reply": "...", "strategy": "the strategy you used"}""";

    public LlmPrompt screenshot(String language) {
        return new LlmPrompt(SCREENSHOT_SYSTEM_PROMPT,
                "Read this chat screenshot. Keep the original language of the messages (" + language + ").");
    }

    public LlmPrompt imageDescription(String language) {
        return new LlmPrompt(IMAGE_DESCRIPTION_SYSTEM_PROMPT, "Describe this image in " + language + ".");
    }

    public LlmPrompt context(List<DialogEntry> conversation) {
        return new LlmPrompt(CONTEXT_SYSTEM_PROMPT, "Conversation history:\n" + format(conversation));
    }

    public LlmPrompt scene(List<DialogEntry> conversation, String screenshotScenario) {
        return new LlmPrompt(SCENE_SYSTEM_PROMPT, sceneInput(conversation, screenshotScenario));
    }

    public LlmPrompt merged(List<DialogEntry> conversation, String screenshotScenario) {
        return new LlmPrompt(MERGED_SYSTEM_PROMPT, sceneInput(conversation, screenshotScenario));
    }

    public LlmPrompt persona(ContextAnalysis context, String userId) {
        StringBuilder sb = new StringBuilder();
        sb.append("User id: ").append(userId).append("\n");
        sb.append("Conversation summary: ").append(context.conversationSummary()).append("\n\n");
        sb.append("Conversation:\n").append(format(context.conversation()));
        return new LlmPrompt(PERSONA_SYSTEM_PROMPT, sb.toString());
    }

    public LlmPrompt reply(ContextAnalysis context,
                           SceneAnalysis scene,
                           PersonaSnapshot persona,
                           QualityTier quality,
                           String language) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Scenario\n");
        sb.append("Relationship: ").append(scene.relationshipState()).append("\n");
        sb.append("Current: ").append(scene.currentScenario()).append("\n");
        sb.append("Recommended: ").append(scene.recommendedScenario()).append("\n");
        if (!scene.recommendedStrategies().isEmpty()) {
            sb.append("Strategies: ").append(String.join(", ", scene.recommendedStrategies())).append("\n");
        }
        sb.append("\n## Intimacy\n");
        sb.append("Target: ").append(scene.intimacyLevel()).append("\n");
        sb.append("Current: ").append(context.currentIntimacyLevel()).append("\n");
        sb.append("\n## Emotion\n").append(context.emotionState()).append("\n");
        sb.append("\n## Summary\n").append(context.conversationSummary()).append("\n");
        sb.append("\n## History\n").append(format(context.conversation())).append("\n");
        sb.append("\n## User style\n");
        sb.append("Pacing: ").append(persona.pacing())
                .append(", risk tolerance: ").append(persona.riskTolerance()).append("\n");
        if (persona.stylePrompt() != null && !persona.stylePrompt().isBlank()) {
            sb.append(persona.stylePrompt()).append("\n");
        }
        sb.append("\n## Task\n").append(TIER_GUIDANCE.get(quality)).append("\n");
        sb.append("Write the reply in ").append(language).append(".");
        return new LlmPrompt(REPLY_SYSTEM_PROMPT, sb.toString());
    }

    private String sceneInput(List<DialogEntry> conversation, String screenshotScenario) {
        StringBuilder sb = new StringBuilder();
        if (screenshotScenario != null && !screenshotScenario.isBlank()) {
            sb.append("Situation seen in the screenshot: ").append(screenshotScenario).append("\n\n");
        }
        sb.append("Conversation history:\n").append(format(conversation));
        return sb.toString();
    }

    static String format(List<DialogEntry> conversation) {
        if (conversation.isEmpty()) {
            return "(no messages)";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < conversation.size(); i++) {
            DialogEntry entry = conversation.get(i);
            sb.append('[').append(i + 1).append("] ")
                    .append(entry.speaker()).append(": ")
                    .append(entry.text());
            if (i < conversation.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
