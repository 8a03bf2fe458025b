package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.FlowStrategy;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.domain.reply.model.StageResult;
import com.chatcoach.infrastructure.ai.extraction.StagePayloadMapper;
import com.chatcoach.infrastructure.ai.extraction.StagePayloadMapper.MergedAnalysis;
import com.chatcoach.infrastructure.ai.provider.CallOptions;
import com.chatcoach.infrastructure.ai.provider.Capability;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One provider call produces both the context and the scene result. The call is made only when one
 * of the two keys misses, and at most once per run. Its usage is carried by the context result,
 * or by the scene result when context was served without running this run's loader.
 */
@Slf4j
public class MergedStrategy implements ExecutionStrategy {

    private record MergedCall(StageExecutor.ParsedCall parsed, MergedAnalysis analysis, Usage enrichmentUsage) {}

    private final StageExecutor stages;
    private final MessageEnricher enricher;
    private final StagePromptBuilder prompts;
    private final StagePayloadMapper mapper;

    public MergedStrategy(StageExecutor stages,
                          MessageEnricher enricher,
                          StagePromptBuilder prompts,
                          StagePayloadMapper mapper) {
        this.stages = stages;
        this.enricher = enricher;
        this.prompts = prompts;
        this.mapper = mapper;
    }

    @Override
    public FlowStrategy flow() {
        return FlowStrategy.MERGED;
    }

    @Override
    public CompletableFuture<AnalysisBundle> analyze(PipelineRun run, AnalysisInput input) {
        AtomicReference<CompletableFuture<MergedCall>> call = new AtomicReference<>();
        AtomicBoolean contextLoaderRan = new AtomicBoolean(false);

        // The cache invokes a leader's loader synchronously, so the context loader (if any) has
        // started before the scene lookup below.
        CompletableFuture<StageResult<ContextAnalysis>> context = stages.cached(run, input.contextKey(), () -> {
            contextLoaderRan.set(true);
            return mergedCall(run, input, call).thenApply(merged -> stages.result(StageKind.CONTEXT_ANALYSIS,
                    merged.analysis().context(), merged.parsed(), merged.enrichmentUsage()));
        });
        CompletableFuture<StageResult<SceneAnalysis>> scene = stages.cached(run, input.sceneKey(), () ->
                mergedCall(run, input, call).thenApply(merged -> {
                    StageResult<SceneAnalysis> result = stages.result(StageKind.SCENE_ANALYSIS,
                            merged.analysis().scene(), merged.parsed(), merged.enrichmentUsage());
                    return contextLoaderRan.get() ? result.withoutUsage() : result;
                }));
        return context.thenCombine(scene, AnalysisBundle::new);
    }

    private CompletableFuture<MergedCall> mergedCall(PipelineRun run,
                                                     AnalysisInput input,
                                                     AtomicReference<CompletableFuture<MergedCall>> memo) {
        CompletableFuture<MergedCall> created = new CompletableFuture<>();
        if (!memo.compareAndSet(null, created)) {
            return memo.get();
        }
        log.debug("[Orchestrator] Issuing merged analysis call for request {}", run.requestId());
        CallOptions options = CallOptions.json(run.request().quality(), 0.3, 1200);
        enricher.enrich(run, input.conversation())
                .thenCompose(enriched -> stages.callJson(run, StageKind.CONTEXT_ANALYSIS, Capability.TEXT,
                                prompts.merged(enriched.entries(), input.screenshotScenario()), null, options)
                        .thenApply(parsed -> new MergedCall(parsed,
                                stages.map(run, parsed, (json, raw) -> mapper.splitMerged(json, enriched.entries(), raw)),
                                enriched.usage())))
                .whenComplete((merged, error) -> {
                    if (error == null) {
                        created.complete(merged);
                    } else {
                        created.completeExceptionally(error);
                    }
                });
        return created;
    }
}
