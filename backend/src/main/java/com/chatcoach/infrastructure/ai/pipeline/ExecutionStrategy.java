package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.FlowStrategy;

import java.util.concurrent.CompletableFuture;

/**
 * Produces the context and scene results of a run. Implementations must store their results under
 * {@link AnalysisInput#contextKey()} and {@link AnalysisInput#sceneKey()}.
 */
public interface ExecutionStrategy {

    FlowStrategy flow();

    CompletableFuture<AnalysisBundle> analyze(PipelineRun run, AnalysisInput input);
}
