package com.chatcoach.infrastructure.ai.cache;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.PersonaSnapshot;
import com.chatcoach.domain.reply.model.QualityTier;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.domain.reply.model.StagePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Builds deterministic SHA-256 stage keys. Both flows derive their keys here, so a stage computed
 * by one flow is found by the other. Fields are length-prefixed; payloads are hashed through
 * canonical JSON (sorted properties).
 */
@Component
public class CacheKeyBuilder {

    private final JsonMapper canonicalMapper = JsonMapper.builder()
            .findAndAddModules()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    /**
     * @param imageRef screenshot reference as supplied by the caller
     */
    public CacheKey imageKey(String imageRef) {
        return new CacheKey(StageKind.IMAGE_RESULT, sha256(field(imageRef)));
    }

    /**
     * @param conversation   effective conversation: request dialogs followed by screenshot dialogs
     * @param participantIds user id and target id
     */
    public CacheKey contextKey(List<DialogEntry> conversation, List<String> participantIds) {
        StringBuilder raw = new StringBuilder(conversationContent(conversation));
        for (String id : participantIds) {
            raw.append(field(id));
        }
        return new CacheKey(StageKind.CONTEXT_ANALYSIS, sha256(raw.toString()));
    }

    public CacheKey sceneKey(List<DialogEntry> conversation) {
        return new CacheKey(StageKind.SCENE_ANALYSIS, sha256(conversationContent(conversation)));
    }

    /**
     * Scene key for a screenshot request. The request's own dialogs are part of the key, so the same
     * screenshot sent with different typed messages gets its own scene.
     *
     * @param imageKey key of the screenshot's image stage
     * @param dialogs  dialogs supplied with the request, may be empty
     */
    public CacheKey sceneKey(CacheKey imageKey, List<DialogEntry> dialogs) {
        String raw = field("image") + field(imageKey.fingerprint()) + conversationContent(dialogs);
        return new CacheKey(StageKind.SCENE_ANALYSIS, sha256(raw));
    }

    public CacheKey personaKey(ContextAnalysis context, String userId) {
        return new CacheKey(StageKind.PERSONA_ANALYSIS, sha256(canonical(context) + field(userId)));
    }

    public CacheKey replyKey(ContextAnalysis context,
                             SceneAnalysis scene,
                             PersonaSnapshot persona,
                             QualityTier quality,
                             String language) {
        String raw = canonical(context)
                + canonical(scene)
                + canonical(persona)
                + field(quality.name())
                + field(language);
        return new CacheKey(StageKind.REPLY, sha256(raw));
    }

    private String conversationContent(List<DialogEntry> conversation) {
        StringBuilder raw = new StringBuilder(field(Integer.toString(conversation.size())));
        for (DialogEntry entry : conversation) {
            raw.append(field(entry.speaker())).append(field(entry.text()));
        }
        return raw.toString();
    }

    private String canonical(StagePayload payload) {
        try {
            return field(payload.kind().tag()) + field(canonicalMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + payload.kind() + " payload", e);
        }
    }

    private static String field(String value) {
        String v = value != null ? value : "";
        return v.length() + ":" + v + "|";
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
