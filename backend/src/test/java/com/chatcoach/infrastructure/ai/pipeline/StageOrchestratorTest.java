package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.ErrorKind;
import com.chatcoach.domain.reply.model.FlowStrategy;
import com.chatcoach.domain.reply.model.PipelineRequest;
import com.chatcoach.domain.reply.model.PipelineResult;
import com.chatcoach.domain.reply.model.QualityTier;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.domain.reply.model.StagePayload;
import com.chatcoach.domain.reply.model.StageResult;
import com.chatcoach.infrastructure.ai.ReplyPipelineException;
import com.chatcoach.infrastructure.ai.cache.CacheBackendException;
import com.chatcoach.infrastructure.ai.cache.CacheKey;
import com.chatcoach.infrastructure.ai.cache.CacheKeyBuilder;
import com.chatcoach.infrastructure.ai.cache.CacheMetricsTracker;
import com.chatcoach.infrastructure.ai.cache.CaffeineStageCache;
import com.chatcoach.infrastructure.ai.cache.StageCache;
import com.chatcoach.infrastructure.ai.extraction.FailedOutputRecord;
import com.chatcoach.infrastructure.ai.extraction.FailedOutputStore;
import com.chatcoach.infrastructure.ai.extraction.ResilientJsonExtractor;
import com.chatcoach.infrastructure.ai.extraction.StagePayloadMapper;
import com.chatcoach.infrastructure.ai.preprocessing.TextNormalizer;
import com.chatcoach.infrastructure.ai.provider.ProviderAdapter;
import com.chatcoach.infrastructure.ai.provider.ProviderRateLimitedException;
import com.chatcoach.infrastructure.ai.provider.ProviderRegistry;
import com.chatcoach.infrastructure.ai.provider.ProviderRequestException;
import com.chatcoach.infrastructure.trace.TraceEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StageOrchestratorTest {

    static final String SCREENSHOT_JSON = """
            {"dialogs": [{"speaker": "talker", "text": "Are you free Friday?", "from_user": false}],
             "scenario": "dinner invitation"}""";

    static final String CONTEXT_JSON = """
            {"conversation_summary": "Planning a first date", "emotion_state": "positive",
             "current_intimacy_level": 60, "risk_flags": []}""";

    static final String SCENE_JSON = """
            {"relationship_state": "propulsion", "current_scenario": "planning a date",
             "recommended_scenario": "BALANCED", "intimacy_level": 65, "risk_flags": [],
             "recommended_strategies": ["suggest a concrete time"]}""";

    static final String MERGED_JSON = "{\"conversation_analysis\": " + CONTEXT_JSON
            + ", \"scenario_decision\": " + SCENE_JSON + "}";

    static final String PERSONA_JSON = """
            {"pacing": "normal", "risk_tolerance": "medium", "confidence": 0.8,
             "prompt": "Writes casually and warmly."}""";

    static final String REPLY_JSON = """
            ```json
            {"reply": "Friday works! How about 7?", "strategy": "suggest a concrete time"}
            ```""";

    static String standard(FakeProviderAdapter.Stage stage) {
        return switch (stage) {
            case SCREENSHOT -> SCREENSHOT_JSON;
            case IMAGE_DESCRIPTION -> "A photo of a restaurant";
            case CONTEXT -> CONTEXT_JSON;
            case SCENE -> SCENE_JSON;
            case MERGED -> MERGED_JSON;
            case PERSONA -> PERSONA_JSON;
            case REPLY -> REPLY_JSON;
        };
    }

    static final FakeProviderAdapter.Responder STANDARD = (stage, prompt, image) -> standard(stage);

    @Mock
    private FailedOutputStore failedOutputs;

    private ExecutorService executor;
    private RecordingTraceCollector trace;
    private CacheMetricsTracker metrics;
    private StageCache cache;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        trace = new RecordingTraceCollector();
        metrics = new CacheMetricsTracker();
        cache = new CaffeineStageCache(1_000, metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private StageOrchestrator orchestrator(StageCache stageCache, ProviderAdapter... adapters) {
        PipelineRuntime runtime = new PipelineRuntime(stageCache, new ProviderRegistry(List.of(adapters)),
                trace, failedOutputs, executor, Duration.ofHours(1));
        PipelineConfig config = new PipelineConfig();
        StagePromptBuilder prompts = new StagePromptBuilder();
        StagePayloadMapper mapper = new StagePayloadMapper();
        TextNormalizer normalizer = new TextNormalizer();
        ProviderFallbackInvoker invoker = config.providerFallbackInvoker(runtime);
        StageExecutor stages = config.stageExecutor(runtime, invoker,
                new ResilientJsonExtractor(new ObjectMapper(), failedOutputs, 200));
        MessageEnricher enricher = config.messageEnricher(invoker, normalizer, prompts, executor);
        return new StageOrchestrator(new CacheKeyBuilder(), prompts, mapper, stages,
                config.traditionalStrategy(stages, enricher, prompts, mapper, normalizer),
                config.mergedStrategy(stages, enricher, prompts, mapper));
    }

    private StageOrchestrator orchestrator(ProviderAdapter... adapters) {
        return orchestrator(cache, adapters);
    }

    private static PipelineRequest request(String requestId, FlowStrategy strategy) {
        return new PipelineRequest(requestId, "u1", "t1", "c1",
                List.of(new DialogEntry("talker", "Hey, how was your week?"),
                        new DialogEntry("user", "Busy but good! You?"),
                        new DialogEntry("talker", "Same. We should grab dinner sometime")),
                "en", QualityTier.NORMAL, null, strategy);
    }

    private static List<StageKind> kinds(PipelineResult result) {
        return result.stages().stream().map(StageResult::kind).toList();
    }

    @Nested
    @DisplayName("Traditional flow")
    class Traditional {

        @Test
        @DisplayName("One call per stage and the reply text from the reply stage")
        void full_run() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);

            PipelineResult result = orchestrator(provider)
                    .generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(result.replyText()).isEqualTo("Friday works! How about 7?");
            assertThat(result.provider()).isEqualTo("a");
            assertThat(result.model()).isEqualTo("a-model");
            assertThat(kinds(result)).containsExactly(StageKind.CONTEXT_ANALYSIS, StageKind.SCENE_ANALYSIS,
                    StageKind.PERSONA_ANALYSIS, StageKind.REPLY);
            assertThat(result.stages()).noneMatch(StageResult::fromCache);
            assertThat(provider.calls(FakeProviderAdapter.Stage.CONTEXT)).isEqualTo(1);
            assertThat(provider.calls(FakeProviderAdapter.Stage.SCENE)).isEqualTo(1);
            assertThat(provider.calls(FakeProviderAdapter.Stage.MERGED)).isZero();
            assertThat(provider.calls(FakeProviderAdapter.Stage.PERSONA)).isEqualTo(1);
            assertThat(provider.calls(FakeProviderAdapter.Stage.REPLY)).isEqualTo(1);
        }

        @Test
        @DisplayName("Totals sum the computed stages")
        void token_totals() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);

            PipelineResult result = orchestrator(provider)
                    .generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(result.totalInputTokens()).isEqualTo(400);
            assertThat(result.totalOutputTokens()).isEqualTo(80);
            assertThat(result.totalCostUsd()).isCloseTo(480 / 1_000_000.0, within(1e-12));
        }

        @Test
        @DisplayName("A repeated request is served from the cache without provider calls")
        void repeated_request_hits_cache() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);
            StageOrchestrator orchestrator = orchestrator(provider);

            orchestrator.generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));
            PipelineResult second = orchestrator.generate(request("r2", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(provider.totalCalls()).isEqualTo(4);
            assertThat(second.stages()).allMatch(StageResult::fromCache);
            assertThat(second.totalInputTokens()).isZero();
            assertThat(second.totalOutputTokens()).isZero();
            assertThat(second.replyText()).isEqualTo("Friday works! How about 7?");
            assertThat(trace.events(TraceEvent.Type.STAGE_COMPLETED))
                    .filteredOn(e -> e.requestId().equals("r2"))
                    .allMatch(e -> e.fromCache() && "cache_hit".equals(e.outcome()));
        }

        @Test
        @DisplayName("Concurrent identical requests share each stage computation")
        void concurrent_requests_single_flight() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, (stage, prompt, image) -> {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return standard(stage);
            });
            StageOrchestrator orchestrator = orchestrator(provider);

            CompletableFuture<PipelineResult> first =
                    orchestrator.generateAsync(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));
            CompletableFuture<PipelineResult> second =
                    orchestrator.generateAsync(request("r2", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(first.join().replyText()).isEqualTo(second.join().replyText());
            assertThat(provider.calls(FakeProviderAdapter.Stage.CONTEXT)).isEqualTo(1);
            assertThat(provider.calls(FakeProviderAdapter.Stage.SCENE)).isEqualTo(1);
            assertThat(metrics.getJoins(StageKind.CONTEXT_ANALYSIS)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Merged flow")
    class Merged {

        @Test
        @DisplayName("One merged call yields both context and scene")
        void single_merged_call() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);

            PipelineResult result = orchestrator(provider)
                    .generate(request("r1", FlowStrategy.MERGED), Duration.ofSeconds(10));

            assertThat(result.replyText()).isEqualTo("Friday works! How about 7?");
            assertThat(kinds(result)).containsExactly(StageKind.CONTEXT_ANALYSIS, StageKind.SCENE_ANALYSIS,
                    StageKind.PERSONA_ANALYSIS, StageKind.REPLY);
            assertThat(provider.calls(FakeProviderAdapter.Stage.MERGED)).isEqualTo(1);
            assertThat(provider.calls(FakeProviderAdapter.Stage.CONTEXT)).isZero();
            assertThat(provider.calls(FakeProviderAdapter.Stage.SCENE)).isZero();
        }

        @Test
        @DisplayName("Usage of the merged call is counted once")
        void merged_usage_counted_once() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);

            PipelineResult result = orchestrator(provider)
                    .generate(request("r1", FlowStrategy.MERGED), Duration.ofSeconds(10));

            StageResult<?> context = result.stages().get(0);
            StageResult<?> scene = result.stages().get(1);
            assertThat(context.inputTokens()).isEqualTo(100);
            assertThat(scene.inputTokens()).isZero();
            assertThat(result.totalInputTokens()).isEqualTo(300);
            assertThat(result.totalOutputTokens()).isEqualTo(60);
        }

        @Test
        @DisplayName("Stages computed by the merged flow are reused by the traditional flow")
        void merged_then_traditional() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);
            StageOrchestrator orchestrator = orchestrator(provider);

            orchestrator.generate(request("r1", FlowStrategy.MERGED), Duration.ofSeconds(10));
            PipelineResult traditional = orchestrator.generate(request("r2", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(provider.calls(FakeProviderAdapter.Stage.CONTEXT)).isZero();
            assertThat(provider.calls(FakeProviderAdapter.Stage.SCENE)).isZero();
            assertThat(traditional.servedFromCache(StageKind.CONTEXT_ANALYSIS)).isTrue();
            assertThat(traditional.servedFromCache(StageKind.SCENE_ANALYSIS)).isTrue();
        }

        @Test
        @DisplayName("Stages computed by the traditional flow are reused by the merged flow")
        void traditional_then_merged() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);
            StageOrchestrator orchestrator = orchestrator(provider);

            orchestrator.generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));
            PipelineResult merged = orchestrator.generate(request("r2", FlowStrategy.MERGED), Duration.ofSeconds(10));

            assertThat(provider.calls(FakeProviderAdapter.Stage.MERGED)).isZero();
            assertThat(merged.servedFromCache(StageKind.CONTEXT_ANALYSIS)).isTrue();
            assertThat(merged.servedFromCache(StageKind.SCENE_ANALYSIS)).isTrue();
        }

        @Test
        @DisplayName("A cached context still lets the merged call fill a missing scene")
        void merged_fills_missing_scene() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);
            StageOrchestrator orchestrator = orchestrator(provider);
            CacheKeyBuilder keys = new CacheKeyBuilder();
            PipelineRequest first = request("r1", FlowStrategy.MERGED);

            orchestrator.generate(first, Duration.ofSeconds(10));
            cache.invalidate(keys.sceneKey(first.dialogs()));
            PipelineResult second = orchestrator.generate(request("r2", FlowStrategy.MERGED), Duration.ofSeconds(10));

            assertThat(provider.calls(FakeProviderAdapter.Stage.MERGED)).isEqualTo(2);
            assertThat(second.servedFromCache(StageKind.CONTEXT_ANALYSIS)).isTrue();
            assertThat(second.servedFromCache(StageKind.SCENE_ANALYSIS)).isFalse();
            assertThat(second.stages().get(1).inputTokens()).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("Screenshot input")
    class Screenshot {

        @Test
        @DisplayName("Recognised dialogs feed the analysis stages")
        void screenshot_flow() {
            List<String> analysisInputs = new ArrayList<>();
            FakeProviderAdapter provider = FakeProviderAdapter.withVision("v", 1, (stage, prompt, image) -> {
                if (stage == FakeProviderAdapter.Stage.SCENE) {
                    synchronized (analysisInputs) {
                        analysisInputs.add(prompt.userMessage());
                    }
                }
                return standard(stage);
            });
            PipelineRequest request = new PipelineRequest("r1", "u1", "t1", "c1", List.of(),
                    "en", QualityTier.PREMIUM, "https://cdn.example.com/chat.png", FlowStrategy.TRADITIONAL);

            PipelineResult result = orchestrator(provider).generate(request, Duration.ofSeconds(10));

            assertThat(kinds(result)).containsExactly(StageKind.IMAGE_RESULT, StageKind.CONTEXT_ANALYSIS,
                    StageKind.SCENE_ANALYSIS, StageKind.PERSONA_ANALYSIS, StageKind.REPLY);
            assertThat(provider.calls(FakeProviderAdapter.Stage.SCREENSHOT)).isEqualTo(1);
            assertThat(analysisInputs).singleElement().satisfies(input -> {
                assertThat(input).contains("Are you free Friday?");
                assertThat(input).contains("dinner invitation");
            });
        }

        @Test
        @DisplayName("The same screenshot with different typed dialogs gets its own scene")
        void screenshot_scene_follows_dialogs() {
            FakeProviderAdapter provider = FakeProviderAdapter.withVision("v", 1, STANDARD);
            StageOrchestrator orchestrator = orchestrator(provider);
            PipelineRequest sad = new PipelineRequest("r1", "u1", "t1", "c1",
                    List.of(new DialogEntry("talker", "my dog died")),
                    "en", QualityTier.NORMAL, "https://cdn.example.com/chat.png", FlowStrategy.TRADITIONAL);
            PipelineRequest party = new PipelineRequest("r2", "u1", "t1", "c1",
                    List.of(new DialogEntry("talker", "Let's go party tonight!!")),
                    "en", QualityTier.NORMAL, "https://cdn.example.com/chat.png", FlowStrategy.TRADITIONAL);

            orchestrator.generate(sad, Duration.ofSeconds(10));
            PipelineResult second = orchestrator.generate(party, Duration.ofSeconds(10));

            assertThat(provider.calls(FakeProviderAdapter.Stage.SCREENSHOT)).isEqualTo(1);
            assertThat(provider.calls(FakeProviderAdapter.Stage.SCENE)).isEqualTo(2);
            assertThat(second.servedFromCache(StageKind.IMAGE_RESULT)).isTrue();
            assertThat(second.servedFromCache(StageKind.SCENE_ANALYSIS)).isFalse();
        }

        @Test
        @DisplayName("A screenshot without any vision provider fails as capability unsupported")
        void screenshot_without_vision() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);
            PipelineRequest request = new PipelineRequest("r1", "u1", "t1", "c1", List.of(),
                    "en", QualityTier.NORMAL, "https://cdn.example.com/chat.png", FlowStrategy.TRADITIONAL);

            assertThatThrownBy(() -> orchestrator(provider).generate(request, Duration.ofSeconds(10)))
                    .isInstanceOfSatisfying(ReplyPipelineException.class, e -> {
                        assertThat(e.getStage()).isEqualTo(StageKind.IMAGE_RESULT);
                        assertThat(e.getErrorKind()).isEqualTo(ErrorKind.CAPABILITY_UNSUPPORTED);
                    });
            assertThat(provider.totalCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A rate-limited provider falls back to the next one")
        void fallback_across_providers() {
            FakeProviderAdapter limited = FakeProviderAdapter.textOnly("a", 1, (stage, prompt, image) -> {
                throw new ProviderRateLimitedException("a", "429");
            });
            FakeProviderAdapter backup = FakeProviderAdapter.textOnly("b", 2, STANDARD);

            PipelineResult result = orchestrator(limited, backup)
                    .generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(result.provider()).isEqualTo("b");
            assertThat(result.stages()).allMatch(s -> "b".equals(s.provider()));
            assertThat(limited.totalCalls()).isEqualTo(4);
        }

        @Test
        @DisplayName("A failed stage reports its kind and earlier stages are reused on retry")
        void failure_then_retry_reuses_cache() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, (stage, prompt, image) -> {
                if (stage == FakeProviderAdapter.Stage.REPLY) {
                    throw new ProviderRequestException("a", "HTTP 400", new IllegalArgumentException("prompt too long"));
                }
                return standard(stage);
            });
            StageOrchestrator orchestrator = orchestrator(provider);

            assertThatThrownBy(() -> orchestrator.generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10)))
                    .isInstanceOfSatisfying(ReplyPipelineException.class, e -> {
                        assertThat(e.getStage()).isEqualTo(StageKind.REPLY);
                        assertThat(e.getErrorKind()).isEqualTo(ErrorKind.PROVIDER_REQUEST);
                    });

            provider.respondWith(STANDARD);
            PipelineResult retry = orchestrator.generate(request("r2", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(retry.servedFromCache(StageKind.CONTEXT_ANALYSIS)).isTrue();
            assertThat(retry.servedFromCache(StageKind.SCENE_ANALYSIS)).isTrue();
            assertThat(retry.servedFromCache(StageKind.PERSONA_ANALYSIS)).isTrue();
            assertThat(retry.servedFromCache(StageKind.REPLY)).isFalse();
            assertThat(provider.calls(FakeProviderAdapter.Stage.CONTEXT)).isEqualTo(1);
            assertThat(provider.calls(FakeProviderAdapter.Stage.REPLY)).isEqualTo(2);
        }

        @Test
        @DisplayName("Output that cannot be repaired fails the stage and is persisted")
        void unparsable_reply() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, (stage, prompt, image) ->
                    stage == FakeProviderAdapter.Stage.REPLY ? "Sorry, I can't help with that." : standard(stage));

            assertThatThrownBy(() -> orchestrator(provider)
                    .generate(request("r-bad", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10)))
                    .isInstanceOfSatisfying(ReplyPipelineException.class, e -> {
                        assertThat(e.getStage()).isEqualTo(StageKind.REPLY);
                        assertThat(e.getErrorKind()).isEqualTo(ErrorKind.UNPARSABLE_MODEL_OUTPUT);
                    });

            ArgumentCaptor<FailedOutputRecord> saved = ArgumentCaptor.forClass(FailedOutputRecord.class);
            verify(failedOutputs, atLeastOnce()).save(saved.capture());
            assertThat(saved.getValue().requestId()).isEqualTo("r-bad");
            assertThat(saved.getValue().rawTextTruncated()).startsWith("Sorry");
        }

        @Test
        @DisplayName("A stage still running at the deadline fails with TIMEOUT")
        void deadline_exceeded() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, (stage, prompt, image) -> {
                if (stage == FakeProviderAdapter.Stage.PERSONA) {
                    try {
                        Thread.sleep(3_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return standard(stage);
            });

            long start = System.nanoTime();
            assertThatThrownBy(() -> orchestrator(provider)
                    .generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofMillis(500)))
                    .isInstanceOfSatisfying(ReplyPipelineException.class, e -> {
                        assertThat(e.getStage()).isEqualTo(StageKind.PERSONA_ANALYSIS);
                        assertThat(e.getErrorKind()).isEqualTo(ErrorKind.TIMEOUT);
                    });
            assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(2_500);
        }

        @Test
        @DisplayName("A broken cache backend degrades to computing every stage")
        void broken_cache_degrades() {
            FakeProviderAdapter provider = FakeProviderAdapter.textOnly("a", 1, STANDARD);

            PipelineResult result = orchestrator(new BrokenStageCache(), provider)
                    .generate(request("r1", FlowStrategy.TRADITIONAL), Duration.ofSeconds(10));

            assertThat(result.replyText()).isEqualTo("Friday works! How about 7?");
            assertThat(result.stages()).noneMatch(StageResult::fromCache);
            assertThat(provider.totalCalls()).isEqualTo(4);
        }
    }

    private static final class BrokenStageCache implements StageCache {

        @Override
        public Optional<StageResult<?>> get(CacheKey key) {
            throw new CacheBackendException("connection refused");
        }

        @Override
        public void put(CacheKey key, StageResult<?> result, Duration ttl) {
            throw new CacheBackendException("connection refused");
        }

        @Override
        public void invalidate(CacheKey key) {
            throw new CacheBackendException("connection refused");
        }

        @Override
        public <T extends StagePayload> CompletableFuture<StageResult<T>> getOrCompute(
                CacheKey key, Duration ttl, Supplier<CompletableFuture<StageResult<T>>> loader) {
            throw new CacheBackendException("connection refused");
        }
    }
}
