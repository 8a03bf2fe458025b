package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.FlowStrategy;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.domain.reply.model.StageResult;
import com.chatcoach.infrastructure.ai.extraction.StagePayloadMapper;
import com.chatcoach.infrastructure.ai.preprocessing.TextNormalizer;
import com.chatcoach.infrastructure.ai.provider.CallOptions;
import com.chatcoach.infrastructure.ai.provider.Capability;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One provider call per stage: context and scene run in parallel.
 */
public class TraditionalStrategy implements ExecutionStrategy {

    private final StageExecutor stages;
    private final MessageEnricher enricher;
    private final StagePromptBuilder prompts;
    private final StagePayloadMapper mapper;
    private final TextNormalizer normalizer;

    public TraditionalStrategy(StageExecutor stages,
                               MessageEnricher enricher,
                               StagePromptBuilder prompts,
                               StagePayloadMapper mapper,
                               TextNormalizer normalizer) {
        this.stages = stages;
        this.enricher = enricher;
        this.prompts = prompts;
        this.mapper = mapper;
        this.normalizer = normalizer;
    }

    @Override
    public FlowStrategy flow() {
        return FlowStrategy.TRADITIONAL;
    }

    @Override
    public CompletableFuture<AnalysisBundle> analyze(PipelineRun run, AnalysisInput input) {
        CompletableFuture<StageResult<ContextAnalysis>> context =
                stages.cached(run, input.contextKey(), () -> computeContext(run, input));
        CompletableFuture<StageResult<SceneAnalysis>> scene =
                stages.cached(run, input.sceneKey(), () -> computeScene(run, input));
        return context.thenCombine(scene, AnalysisBundle::new);
    }

    private CompletableFuture<StageResult<ContextAnalysis>> computeContext(PipelineRun run, AnalysisInput input) {
        CallOptions options = CallOptions.json(run.request().quality(), 0.3, 600);
        return enricher.enrich(run, input.conversation())
                .thenCompose(enriched -> stages.callJson(run, StageKind.CONTEXT_ANALYSIS, Capability.TEXT,
                                prompts.context(enriched.entries()), null, options)
                        .thenApply(parsed -> stages.result(StageKind.CONTEXT_ANALYSIS,
                                stages.map(run, parsed, (json, raw) -> mapper.toContext(json, enriched.entries())),
                                parsed, enriched.usage())));
    }

    private CompletableFuture<StageResult<SceneAnalysis>> computeScene(PipelineRun run, AnalysisInput input) {
        List<DialogEntry> conversation = input.conversation().stream()
                .map(normalizer::normalize)
                .toList();
        CallOptions options = CallOptions.json(run.request().quality(), 0.3, 600);
        return stages.callJson(run, StageKind.SCENE_ANALYSIS, Capability.TEXT,
                        prompts.scene(conversation, input.screenshotScenario()), null, options)
                .thenApply(parsed -> stages.result(StageKind.SCENE_ANALYSIS,
                        stages.map(run, parsed, (json, raw) -> mapper.toScene(json)),
                        parsed, Usage.NONE));
    }
}
