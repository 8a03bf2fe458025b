package com.chatcoach.infrastructure.ai.extraction;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.ImageAnalysis;
import com.chatcoach.domain.reply.model.ImageAnalysis.RecognizedDialog;
import com.chatcoach.domain.reply.model.PersonaSnapshot;
import com.chatcoach.domain.reply.model.ReplyDraft;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps extracted JSON trees onto typed stage payloads, filling defaults and clamping ranges.
 */
@Slf4j
@Component
public class StagePayloadMapper {

    public record MergedAnalysis(ContextAnalysis context, SceneAnalysis scene) {}

    static final String CONVERSATION_SECTION = "conversation_analysis";
    static final String SCENARIO_SECTION = "scenario_decision";

    private static final Set<String> EMOTION_STATES = Set.of("positive", "neutral", "negative");
    private static final Set<String> SCENARIOS = Set.of("SAFE", "BALANCED", "RISKY", "RECOVERY", "NEGATIVE");
    private static final Set<String> PACINGS = Set.of("slow", "normal", "fast");
    private static final Set<String> RISK_TOLERANCES = Set.of("low", "medium", "high");
    private static final Map<String, String> RELATIONSHIP_STATES = Map.of(
            "ignition", "ignition",
            "propulsion", "propulsion",
            "ventilation", "ventilation",
            "equilibrium", "equilibrium",
            "破冰", "ignition",
            "推进", "propulsion",
            "冷却", "ventilation",
            "维持", "equilibrium");

    private static final int DEFAULT_INTIMACY = 50;
    private static final double DEFAULT_CONFIDENCE = 0.5;

    public ContextAnalysis toContext(JsonNode node, List<DialogEntry> conversation) {
        return new ContextAnalysis(
                text(node, "conversation_summary"),
                oneOf(node, "emotion_state", EMOTION_STATES, "neutral"),
                intimacy(node, "current_intimacy_level"),
                stringList(node, "risk_flags"),
                conversation);
    }

    public SceneAnalysis toScene(JsonNode node) {
        String relationship = text(node, "relationship_state");
        String mappedRelationship = RELATIONSHIP_STATES.get(relationship);
        if (mappedRelationship == null) {
            if (!relationship.isEmpty()) {
                log.warn("[Mapper] Invalid relationship_state '{}', defaulting to 'equilibrium'", relationship);
            }
            mappedRelationship = "equilibrium";
        }
        String recommended = oneOf(node, "recommended_scenario", SCENARIOS, "SAFE");
        return new SceneAnalysis(
                mappedRelationship,
                text(node, "current_scenario"),
                recommended,
                intimacy(node, "intimacy_level"),
                stringList(node, "risk_flags"),
                stringList(node, "recommended_strategies"));
    }

    public PersonaSnapshot toPersona(JsonNode node) {
        double confidence = DEFAULT_CONFIDENCE;
        JsonNode raw = node.get("confidence");
        if (raw != null && raw.isNumber()) {
            confidence = Math.max(0.0, Math.min(1.0, raw.asDouble()));
        }
        return new PersonaSnapshot(
                oneOf(node, "pacing", PACINGS, "normal"),
                oneOf(node, "risk_tolerance", RISK_TOLERANCES, "medium"),
                confidence,
                text(node, "prompt"));
    }

    /**
     * Accepts {@code dialogs[{speaker,text,from_user}]} or the screenshot-parser shape
     * {@code bubbles[{sender,text}]}.
     */
    public ImageAnalysis toImage(JsonNode node) {
        List<RecognizedDialog> dialogs = new ArrayList<>();
        JsonNode items = node.path("dialogs");
        if (items.isArray()) {
            for (JsonNode item : items) {
                String speaker = item.path("speaker").asText("");
                boolean fromUser = item.has("from_user")
                        ? item.path("from_user").asBoolean()
                        : isSelf(speaker);
                dialogs.add(new RecognizedDialog(speaker, item.path("text").asText(""), fromUser));
            }
        } else if (node.path("bubbles").isArray()) {
            for (JsonNode bubble : node.path("bubbles")) {
                String sender = bubble.path("sender").asText("user");
                dialogs.add(new RecognizedDialog(sender, bubble.path("text").asText(""), isSelf(sender)));
            }
        }
        return new ImageAnalysis(dialogs, text(node, "scenario"));
    }

    /**
     * @throws UnparsableModelOutputException when the output carries no reply text
     */
    public ReplyDraft toReply(JsonNode node, String rawText) {
        String reply = text(node, "reply");
        if (reply.isBlank()) {
            reply = text(node, "text");
        }
        if (reply.isBlank() && node.path("replies").isArray() && !node.path("replies").isEmpty()) {
            JsonNode first = node.path("replies").get(0);
            reply = first.isTextual() ? first.asText() : first.path("text").asText("");
        }
        if (reply.isBlank()) {
            throw new UnparsableModelOutputException("Reply output has no reply text",
                    rawText, RepairStep.PARSE, excerpt(rawText));
        }
        return new ReplyDraft(reply.strip(), text(node, "strategy"));
    }

    /**
     * Splits a merged-flow response into its context and scene parts.
     *
     * @throws UnparsableModelOutputException when either section is missing
     */
    public MergedAnalysis splitMerged(JsonNode root, List<DialogEntry> conversation, String rawText) {
        JsonNode conversationSection = root.get(CONVERSATION_SECTION);
        JsonNode scenarioSection = root.get(SCENARIO_SECTION);
        if (conversationSection == null || !conversationSection.isObject()
                || scenarioSection == null || !scenarioSection.isObject()) {
            throw new UnparsableModelOutputException(
                    "Merged output requires '" + CONVERSATION_SECTION + "' and '" + SCENARIO_SECTION + "' objects",
                    rawText, RepairStep.PARSE, excerpt(rawText));
        }
        return new MergedAnalysis(toContext(conversationSection, conversation), toScene(scenarioSection));
    }

    private String oneOf(JsonNode node, String field, Set<String> allowed, String fallback) {
        String value = text(node, field);
        if (allowed.contains(value)) {
            return value;
        }
        if (!value.isEmpty()) {
            log.warn("[Mapper] Invalid {} '{}', defaulting to '{}'", field, value, fallback);
        }
        return fallback;
    }

    private int intimacy(JsonNode node, String field) {
        JsonNode raw = node.get(field);
        if (raw == null || raw.isNull()) {
            return DEFAULT_INTIMACY;
        }
        int value;
        if (raw.isNumber()) {
            value = raw.asInt();
        } else {
            try {
                value = (int) Double.parseDouble(raw.asText().strip());
            } catch (NumberFormatException e) {
                log.warn("[Mapper] Non-numeric {} '{}', using {}", field, raw.asText(), DEFAULT_INTIMACY);
                return DEFAULT_INTIMACY;
            }
        }
        if (value < 0 || value > 100) {
            log.warn("[Mapper] {} {} out of range, clamping", field, value);
        }
        return Math.max(0, Math.min(100, value));
    }

    private static List<String> stringList(JsonNode node, String field) {
        JsonNode raw = node.get(field);
        if (raw == null || !raw.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : raw) {
            if (item.isValueNode() && !item.isNull()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode raw = node.get(field);
        return raw == null || raw.isNull() || raw.isContainerNode() ? "" : raw.asText();
    }

    private static boolean isSelf(String speaker) {
        return "user".equalsIgnoreCase(speaker) || "self".equalsIgnoreCase(speaker);
    }

    private static String excerpt(String rawText) {
        if (rawText == null) {
            return "";
        }
        return rawText.length() > 200 ? rawText.substring(0, 200) + "..." : rawText;
    }
}
