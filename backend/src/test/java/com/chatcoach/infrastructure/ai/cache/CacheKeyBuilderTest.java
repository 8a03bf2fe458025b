package com.chatcoach.infrastructure.ai.cache;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.PersonaSnapshot;
import com.chatcoach.domain.reply.model.QualityTier;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.chatcoach.domain.reply.model.StageKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyBuilderTest {

    private final CacheKeyBuilder builder = new CacheKeyBuilder();

    private final List<DialogEntry> conversation = List.of(
            new DialogEntry("talker", "are you free on friday?"),
            new DialogEntry("user", "maybe, why?"));

    private ContextAnalysis context(String summary) {
        return new ContextAnalysis(summary, "neutral", 50, List.of("late_reply"), conversation);
    }

    @Test
    @DisplayName("Same inputs give the same key, as a SHA-256 hex digest")
    void deterministic() {
        CacheKey first = builder.contextKey(conversation, List.of("u1", "t1"));
        CacheKey second = builder.contextKey(List.copyOf(conversation), List.of("u1", "t1"));

        assertThat(first).isEqualTo(second);
        assertThat(first.fingerprint()).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("Storage key is namespaced by the stage tag")
    void namespaced_by_stage() {
        CacheKey context = builder.contextKey(conversation, List.of("u1", "t1"));
        CacheKey scene = builder.sceneKey(conversation);

        assertThat(context.storageKey()).startsWith("context_analysis:");
        assertThat(scene.storageKey()).startsWith("scene_analysis:");
        assertThat(context.kind()).isEqualTo(StageKind.CONTEXT_ANALYSIS);
    }

    @Test
    @DisplayName("Context key depends on participants, scene key does not")
    void participants_only_affect_context() {
        assertThat(builder.contextKey(conversation, List.of("u1", "t1")))
                .isNotEqualTo(builder.contextKey(conversation, List.of("u1", "t2")));
        assertThat(builder.sceneKey(conversation)).isEqualTo(builder.sceneKey(List.copyOf(conversation)));
    }

    @Test
    @DisplayName("Message order and field boundaries matter")
    void order_and_boundaries() {
        List<DialogEntry> reversed = List.of(conversation.get(1), conversation.get(0));
        assertThat(builder.sceneKey(conversation)).isNotEqualTo(builder.sceneKey(reversed));

        List<DialogEntry> a = List.of(new DialogEntry("ab", "c"));
        List<DialogEntry> b = List.of(new DialogEntry("a", "bc"));
        assertThat(builder.sceneKey(a)).isNotEqualTo(builder.sceneKey(b));
    }

    @Test
    @DisplayName("Timestamps are not part of the conversation content")
    void timestamps_ignored() {
        List<DialogEntry> stamped = List.of(
                new DialogEntry("talker", "are you free on friday?", Instant.parse("2024-05-01T10:00:00Z")),
                new DialogEntry("user", "maybe, why?", Instant.parse("2024-05-01T10:01:00Z")));

        assertThat(builder.sceneKey(stamped)).isEqualTo(builder.sceneKey(conversation));
    }

    @Test
    @DisplayName("Image-derived scene key differs from the conversation scene key")
    void image_scene_key() {
        CacheKey imageKey = builder.imageKey("https://cdn.example.com/shot.png");

        assertThat(builder.sceneKey(imageKey, List.of()))
                .isEqualTo(builder.sceneKey(builder.imageKey("https://cdn.example.com/shot.png"), List.of()));
        assertThat(builder.sceneKey(imageKey, List.of())).isNotEqualTo(builder.sceneKey(conversation));
    }

    @Test
    @DisplayName("Same screenshot with different typed dialogs gives different scene keys")
    void image_scene_key_follows_dialogs() {
        CacheKey imageKey = builder.imageKey("chat.png");
        List<DialogEntry> sad = List.of(new DialogEntry("talker", "my dog died"));
        List<DialogEntry> party = List.of(new DialogEntry("talker", "Let's go party tonight!!"));

        assertThat(builder.sceneKey(imageKey, sad)).isNotEqualTo(builder.sceneKey(imageKey, party));
        assertThat(builder.sceneKey(imageKey, sad)).isNotEqualTo(builder.sceneKey(imageKey, List.of()));
        assertThat(builder.sceneKey(imageKey, sad)).isEqualTo(builder.sceneKey(imageKey, List.copyOf(sad)));
    }

    @Test
    @DisplayName("Persona key follows the context payload and the user")
    void persona_key() {
        assertThat(builder.personaKey(context("plans"), "u1"))
                .isEqualTo(builder.personaKey(context("plans"), "u1"));
        assertThat(builder.personaKey(context("plans"), "u1"))
                .isNotEqualTo(builder.personaKey(context("plans"), "u2"));
        assertThat(builder.personaKey(context("plans"), "u1"))
                .isNotEqualTo(builder.personaKey(context("other"), "u1"));
    }

    @Test
    @DisplayName("Reply key follows payloads, quality and language")
    void reply_key() {
        SceneAnalysis scene = new SceneAnalysis("ignition", "", "SAFE", 40, List.of(), List.of("ask_question"));
        PersonaSnapshot persona = new PersonaSnapshot("normal", "medium", 0.5, "casual");

        CacheKey base = builder.replyKey(context("plans"), scene, persona, QualityTier.NORMAL, "en");

        assertThat(builder.replyKey(context("plans"), scene, persona, QualityTier.NORMAL, "en")).isEqualTo(base);
        assertThat(builder.replyKey(context("plans"), scene, persona, QualityTier.PREMIUM, "en")).isNotEqualTo(base);
        assertThat(builder.replyKey(context("plans"), scene, persona, QualityTier.NORMAL, "zh")).isNotEqualTo(base);
        assertThat(base.kind()).isEqualTo(StageKind.REPLY);
    }
}
