package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.ErrorKind;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.domain.reply.model.StagePayload;
import com.chatcoach.domain.reply.model.StageResult;
import com.chatcoach.infrastructure.ai.LlmPrompt;
import com.chatcoach.infrastructure.ai.ReplyPipelineException;
import com.chatcoach.infrastructure.ai.cache.CacheBackendException;
import com.chatcoach.infrastructure.ai.cache.CacheKey;
import com.chatcoach.infrastructure.ai.extraction.FailedOutputRecord;
import com.chatcoach.infrastructure.ai.extraction.ResilientJsonExtractor;
import com.chatcoach.infrastructure.ai.extraction.UnparsableModelOutputException;
import com.chatcoach.infrastructure.ai.provider.CallOptions;
import com.chatcoach.infrastructure.ai.provider.Capability;
import com.chatcoach.infrastructure.ai.provider.ProviderException;
import com.chatcoach.infrastructure.trace.TraceEvent;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Per-stage mechanics shared by both flows: cache lookup with single-flight, provider call with
 * fallback, extraction, trace emission and translation of failures into {@link ReplyPipelineException}.
 */
@Slf4j
public class StageExecutor {

    /**
     * Provider response already extracted into a JSON tree.
     */
    public record ParsedCall(ProviderFallbackInvoker.ProviderCall call, JsonNode json, String rawText) {}

    private final PipelineRuntime runtime;
    private final ProviderFallbackInvoker invoker;
    private final ResilientJsonExtractor extractor;

    public StageExecutor(PipelineRuntime runtime, ProviderFallbackInvoker invoker, ResilientJsonExtractor extractor) {
        this.runtime = runtime;
        this.invoker = invoker;
        this.extractor = extractor;
    }

    /**
     * Serve the stage from the cache or run the loader under single-flight. The caller's wait is
     * bounded by the remaining deadline; a backend failure degrades to running the loader directly.
     */
    public <T extends StagePayload> CompletableFuture<StageResult<T>> cached(
            PipelineRun run, CacheKey key, Supplier<CompletableFuture<StageResult<T>>> loader) {
        run.started(key.kind());
        long start = System.nanoTime();

        CompletableFuture<StageResult<T>> future;
        try {
            future = runtime.cache().getOrCompute(key, runtime.cacheTtl(), loader);
        } catch (CacheBackendException e) {
            log.warn("[Orchestrator] Cache unavailable for {}, computing without it: {}", key, e.getMessage());
            future = loader.get();
        }
        future = future.exceptionallyCompose(error -> {
            if (ProviderFallbackInvoker.unwrap(error) instanceof CacheBackendException) {
                log.warn("[Orchestrator] Cache failed for {}, computing without it: {}", key, error.getMessage());
                return loader.get();
            }
            return CompletableFuture.failedFuture(error);
        });

        long remainingMs = run.deadline().remainingMillis();
        return future.orTimeout(remainingMs, TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    long durationMs = (System.nanoTime() - start) / 1_000_000;
                    if (error == null) {
                        emitStage(run, result, durationMs);
                        return result;
                    }
                    ReplyPipelineException failure = toPipelineException(run, key.kind(), error);
                    runtime.trace().record(new TraceEvent(run.requestId(), TraceEvent.Type.STAGE_COMPLETED,
                            key.kind(), "none", durationMs, 0, 0, false, failure.getErrorKind().name()));
                    throw failure;
                });
    }

    /**
     * One provider call (with fallback) followed by JSON extraction.
     */
    public CompletableFuture<ParsedCall> callJson(PipelineRun run,
                                                  StageKind stage,
                                                  Capability capability,
                                                  LlmPrompt prompt,
                                                  String imageRef,
                                                  CallOptions options) {
        return invoker.invoke(run, stage, capability, adapter -> capability == Capability.VISION
                        ? adapter.callVision(prompt, imageRef, options)
                        : adapter.callText(prompt, options))
                .thenApply(call -> {
                    String raw = call.result().content();
                    return new ParsedCall(call, extractor.extract(raw, run.requestId()), raw);
                });
    }

    /**
     * Map the extracted JSON onto a payload. Mapping failures are persisted like extraction failures.
     */
    public <T> T map(PipelineRun run, ParsedCall parsed, BiFunction<JsonNode, String, T> mapper) {
        try {
            return mapper.apply(parsed.json(), parsed.rawText());
        } catch (UnparsableModelOutputException e) {
            try {
                runtime.failedOutputs().save(FailedOutputRecord.of(run.requestId(), parsed.rawText(), e.getMessage()));
            } catch (RuntimeException storeError) {
                log.error("[Orchestrator] Failed to persist unmappable output for request {}", run.requestId(), storeError);
            }
            throw e;
        }
    }

    public <T extends StagePayload> StageResult<T> result(StageKind kind, T payload, ParsedCall parsed, Usage extra) {
        Usage usage = Usage.of(parsed.call()).plus(extra);
        return new StageResult<>(kind, payload,
                parsed.call().adapter().name(),
                parsed.call().result().model(),
                usage.inputTokens(),
                usage.outputTokens(),
                parsed.call().durationMs(),
                usage.costUsd(),
                false);
    }

    private void emitStage(PipelineRun run, StageResult<?> result, long durationMs) {
        runtime.trace().record(new TraceEvent(run.requestId(), TraceEvent.Type.STAGE_COMPLETED, result.kind(),
                result.fromCache() ? "cache" : result.provider(),
                durationMs,
                result.fromCache() ? 0 : result.inputTokens(),
                result.fromCache() ? 0 : result.outputTokens(),
                result.fromCache(),
                result.fromCache() ? "cache_hit" : "success"));
    }

    static ReplyPipelineException toPipelineException(PipelineRun run, StageKind stage, Throwable error) {
        Throwable cause = ProviderFallbackInvoker.unwrap(error);
        if (cause instanceof ReplyPipelineException rpe) {
            return rpe;
        }
        ErrorKind kind;
        if (cause instanceof PipelineTimeoutException || cause instanceof TimeoutException) {
            kind = ErrorKind.TIMEOUT;
        } else if (cause instanceof ProviderException pe) {
            kind = pe.isRecoverable() && run.deadline().isExpired() ? ErrorKind.TIMEOUT : pe.kind();
        } else if (cause instanceof UnparsableModelOutputException) {
            kind = ErrorKind.UNPARSABLE_MODEL_OUTPUT;
        } else if (cause instanceof CacheBackendException) {
            kind = ErrorKind.CACHE_BACKEND_ERROR;
        } else {
            kind = ErrorKind.INTERNAL;
        }
        String stageName = stage != null ? stage.tag() : "pipeline";
        return new ReplyPipelineException(stage, kind, stageName + " failed (" + kind + "): " + cause.getMessage(), cause);
    }
}
