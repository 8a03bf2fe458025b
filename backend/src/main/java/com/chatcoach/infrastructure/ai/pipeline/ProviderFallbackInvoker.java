package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.ErrorKind;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.infrastructure.ai.LlmCallResult;
import com.chatcoach.infrastructure.ai.provider.Capability;
import com.chatcoach.infrastructure.ai.provider.CapabilityUnsupportedException;
import com.chatcoach.infrastructure.ai.provider.ProviderAdapter;
import com.chatcoach.infrastructure.ai.provider.ProviderException;
import com.chatcoach.infrastructure.ai.provider.ProviderTimeoutException;
import com.chatcoach.infrastructure.ai.provider.ProviderUnavailableException;
import com.chatcoach.infrastructure.trace.TraceEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Calls the capable providers in rank order until one succeeds. Unavailable, rate-limited and
 * timed-out providers hand over to the next candidate; other errors end the stage at once.
 * Every attempt is bounded by the remaining deadline and emits one trace event.
 */
@Slf4j
public class ProviderFallbackInvoker {

    /**
     * Successful attempt together with the adapter that served it.
     */
    public record ProviderCall(LlmCallResult result, ProviderAdapter adapter, long durationMs) {

        public double costUsd() {
            return adapter.costUsd(result.promptTokens(), result.completionTokens());
        }
    }

    private final PipelineRuntime runtime;

    public ProviderFallbackInvoker(PipelineRuntime runtime) {
        this.runtime = runtime;
    }

    public CompletableFuture<ProviderCall> invoke(PipelineRun run,
                                                  StageKind stage,
                                                  Capability capability,
                                                  Function<ProviderAdapter, LlmCallResult> call) {
        List<ProviderAdapter> candidates = runtime.registry().candidates(capability);
        if (candidates.isEmpty()) {
            return CompletableFuture.failedFuture(new CapabilityUnsupportedException("registry",
                    "No configured provider supports " + capability));
        }
        return attempt(run, stage, candidates, 0, call, new ArrayList<>());
    }

    private CompletableFuture<ProviderCall> attempt(PipelineRun run,
                                                    StageKind stage,
                                                    List<ProviderAdapter> candidates,
                                                    int index,
                                                    Function<ProviderAdapter, LlmCallResult> call,
                                                    List<ProviderException> failures) {
        if (run.deadline().isExpired()) {
            return CompletableFuture.failedFuture(new PipelineTimeoutException(
                    "Deadline of " + run.deadline().budget() + " exceeded before " + stage.tag() + " provider call"));
        }
        if (index >= candidates.size()) {
            return CompletableFuture.failedFuture(exhausted(stage, failures));
        }

        ProviderAdapter adapter = candidates.get(index);
        long remainingMs = run.deadline().remainingMillis();
        long start = System.nanoTime();

        return CompletableFuture.supplyAsync(() -> call.apply(adapter), runtime.executor())
                .orTimeout(remainingMs, TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    long durationMs = (System.nanoTime() - start) / 1_000_000;
                    if (error == null) {
                        emit(run, stage, adapter.name(), durationMs,
                                result.promptTokens(), result.completionTokens(), "success");
                        return CompletableFuture.completedFuture(new ProviderCall(result, adapter, durationMs));
                    }

                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        cause = new ProviderTimeoutException(adapter.name(),
                                "No response within the remaining " + remainingMs + "ms", cause);
                    }
                    if (!(cause instanceof ProviderException pe)) {
                        emit(run, stage, adapter.name(), durationMs, 0, 0, ErrorKind.INTERNAL.name());
                        return CompletableFuture.<ProviderCall>failedFuture(cause);
                    }

                    emit(run, stage, adapter.name(), durationMs, 0, 0, pe.kind().name());
                    if (pe instanceof CapabilityUnsupportedException) {
                        log.debug("[Fallback] {} skipped for {}: {}", adapter.name(), stage.tag(), pe.getMessage());
                    } else if (pe.isRecoverable()) {
                        log.warn("[Fallback] {} failed for {} ({}), trying next provider: {}",
                                adapter.name(), stage.tag(), pe.kind(), pe.getMessage());
                    } else {
                        log.error("[Fallback] {} rejected the {} request: {}", adapter.name(), stage.tag(), pe.getMessage());
                        return CompletableFuture.<ProviderCall>failedFuture(pe);
                    }
                    failures.add(pe);
                    return attempt(run, stage, candidates, index + 1, call, failures);
                })
                .thenCompose(Function.identity());
    }

    private RuntimeException exhausted(StageKind stage, List<ProviderException> failures) {
        if (!failures.isEmpty() && failures.stream().allMatch(f -> f instanceof CapabilityUnsupportedException)) {
            CapabilityUnsupportedException unsupported = new CapabilityUnsupportedException("registry",
                    "No provider could serve " + stage.tag());
            failures.forEach(unsupported::addSuppressed);
            return unsupported;
        }
        ProviderUnavailableException exhausted = new ProviderUnavailableException("registry",
                "All " + failures.size() + " providers failed for " + stage.tag());
        failures.forEach(exhausted::addSuppressed);
        return exhausted;
    }

    private void emit(PipelineRun run, StageKind stage, String provider, long durationMs,
                      long inputTokens, long outputTokens, String outcome) {
        runtime.trace().record(new TraceEvent(run.requestId(), TraceEvent.Type.PROVIDER_ATTEMPT, stage,
                provider, durationMs, inputTokens, outputTokens, false, outcome));
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Rethrow a future's failure from inside a completion stage without double wrapping.
     */
    static RuntimeException propagate(Throwable error) {
        if (error instanceof RuntimeException re) {
            return re;
        }
        return new CompletionException(error);
    }
}
