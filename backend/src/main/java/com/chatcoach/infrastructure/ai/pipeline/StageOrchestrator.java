package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.FlowStrategy;
import com.chatcoach.domain.reply.model.ImageAnalysis;
import com.chatcoach.domain.reply.model.PersonaSnapshot;
import com.chatcoach.domain.reply.model.PipelineRequest;
import com.chatcoach.domain.reply.model.PipelineResult;
import com.chatcoach.domain.reply.model.ReplyDraft;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.domain.reply.model.StageResult;
import com.chatcoach.domain.reply.service.ReplyService;
import com.chatcoach.infrastructure.ai.ReplyPipelineException;
import com.chatcoach.infrastructure.ai.cache.CacheKey;
import com.chatcoach.infrastructure.ai.cache.CacheKeyBuilder;
import com.chatcoach.infrastructure.ai.extraction.StagePayloadMapper;
import com.chatcoach.infrastructure.ai.provider.CallOptions;
import com.chatcoach.infrastructure.ai.provider.Capability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the stage graph for one request:
 *
 *   image_result (screenshot only) → [context_analysis ∥ scene_analysis] (per flow)
 *   → persona_analysis (after context) → reply
 *
 * Every stage goes through the stage cache first; keys are shared by both flows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StageOrchestrator implements ReplyService {

    private final CacheKeyBuilder keys;
    private final StagePromptBuilder prompts;
    private final StagePayloadMapper mapper;
    private final StageExecutor stages;
    private final TraditionalStrategy traditional;
    private final MergedStrategy merged;

    @Override
    public CompletableFuture<PipelineResult> generateAsync(PipelineRequest request, Duration deadline) {
        PipelineRun run = new PipelineRun(request, Deadline.after(deadline));
        ExecutionStrategy strategy = request.strategy() == FlowStrategy.MERGED ? merged : traditional;
        long start = System.nanoTime();
        log.info("[Orchestrator] Request {} started: flow={}, dialogs={}, screenshot={}, deadline={}",
                request.requestId(), strategy.flow(), request.dialogs().size(), request.hasImage(), deadline);

        CompletableFuture<PipelineResult> pipeline = imageStage(run)
                .thenCompose(image -> {
                    AnalysisInput input = analysisInput(run, image);
                    return strategy.analyze(run, input)
                            .thenCompose(analysis -> personaStage(run, analysis.context())
                                    .thenCompose(persona -> replyStage(run, analysis, persona)
                                            .thenApply(reply -> {
                                                List<StageResult<?>> chain = new ArrayList<>();
                                                image.ifPresent(chain::add);
                                                chain.add(analysis.context());
                                                chain.add(analysis.scene());
                                                chain.add(persona);
                                                chain.add(reply);
                                                return PipelineResult.assemble(reply, chain,
                                                        (System.nanoTime() - start) / 1_000_000);
                                            })));
                });

        return pipeline
                .orTimeout(Math.max(1, deadline.toMillis()), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error == null) {
                        log.info("[Orchestrator] Request {} done in {}ms: provider={}, tokens={}/{}, cost=${}, cachedStages={}",
                                request.requestId(), result.totalLatencyMs(), result.provider(),
                                result.totalInputTokens(), result.totalOutputTokens(),
                                String.format("%.6f", result.totalCostUsd()),
                                result.stages().stream().filter(StageResult::fromCache).count());
                        return result;
                    }
                    ReplyPipelineException failure = StageExecutor.toPipelineException(run, run.lastStarted(), error);
                    log.warn("[Orchestrator] Request {} failed at {}: {} - {}",
                            request.requestId(), failure.getStage(), failure.getErrorKind(), failure.getMessage());
                    throw failure;
                });
    }

    @Override
    public PipelineResult generate(PipelineRequest request, Duration deadline) {
        try {
            return generateAsync(request, deadline).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReplyPipelineException rpe) throw rpe;
            if (cause instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private CompletableFuture<Optional<StageResult<ImageAnalysis>>> imageStage(PipelineRun run) {
        PipelineRequest request = run.request();
        if (!request.hasImage()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CallOptions options = CallOptions.json(request.quality(), 0.0, 1500);
        return stages.<ImageAnalysis>cached(run, keys.imageKey(request.imageRef()), () ->
                        stages.callJson(run, StageKind.IMAGE_RESULT, Capability.VISION,
                                        prompts.screenshot(request.language()), request.imageRef(), options)
                                .thenApply(parsed -> stages.result(StageKind.IMAGE_RESULT,
                                        stages.map(run, parsed, (json, raw) -> mapper.toImage(json)),
                                        parsed, Usage.NONE)))
                .thenApply(Optional::of);
    }

    private AnalysisInput analysisInput(PipelineRun run, Optional<StageResult<ImageAnalysis>> image) {
        PipelineRequest request = run.request();
        List<DialogEntry> conversation = new ArrayList<>(request.dialogs());
        image.ifPresent(result -> conversation.addAll(result.payload().toDialogEntries()));

        CacheKey contextKey = keys.contextKey(conversation, request.participantIds());
        CacheKey sceneKey = request.hasImage()
                ? keys.sceneKey(keys.imageKey(request.imageRef()), request.dialogs())
                : keys.sceneKey(conversation);
        String scenario = image.map(result -> result.payload().scenario()).orElse(null);
        return new AnalysisInput(List.copyOf(conversation), scenario, contextKey, sceneKey);
    }

    private CompletableFuture<StageResult<PersonaSnapshot>> personaStage(PipelineRun run,
                                                                         StageResult<ContextAnalysis> context) {
        PipelineRequest request = run.request();
        CallOptions options = CallOptions.json(request.quality(), 0.3, 400);
        return stages.cached(run, keys.personaKey(context.payload(), request.userId()), () ->
                stages.callJson(run, StageKind.PERSONA_ANALYSIS, Capability.TEXT,
                                prompts.persona(context.payload(), request.userId()), null, options)
                        .thenApply(parsed -> stages.result(StageKind.PERSONA_ANALYSIS,
                                stages.map(run, parsed, (json, raw) -> mapper.toPersona(json)),
                                parsed, Usage.NONE)));
    }

    private CompletableFuture<StageResult<ReplyDraft>> replyStage(PipelineRun run,
                                                                  AnalysisBundle analysis,
                                                                  StageResult<PersonaSnapshot> persona) {
        PipelineRequest request = run.request();
        ContextAnalysis context = analysis.context().payload();
        SceneAnalysis scene = analysis.scene().payload();
        CacheKey replyKey = keys.replyKey(context, scene, persona.payload(), request.quality(), request.language());
        CallOptions options = CallOptions.json(request.quality(), 0.8, 800);
        return stages.cached(run, replyKey, () ->
                stages.callJson(run, StageKind.REPLY, Capability.TEXT,
                                prompts.reply(context, scene, persona.payload(), request.quality(), request.language()),
                                null, options)
                        .thenApply(parsed -> stages.result(StageKind.REPLY,
                                stages.map(run, parsed, mapper::toReply),
                                parsed, Usage.NONE)));
    }
}
