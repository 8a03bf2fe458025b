package com.chatcoach.domain.reply.service;

import com.chatcoach.domain.reply.model.PipelineRequest;
import com.chatcoach.domain.reply.model.PipelineResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Domain service interface for reply generation from a chat transcript.
 */
public interface ReplyService {

    /**
     * Run the stage pipeline asynchronously.
     *
     * @param request  the generation request
     * @param deadline time budget for the whole pipeline, including every provider call
     * @return future completing with the result, or exceptionally with a ReplyPipelineException
     */
    CompletableFuture<PipelineResult> generateAsync(PipelineRequest request, Duration deadline);

    /**
     * Blocking variant of {@link #generateAsync(PipelineRequest, Duration)}.
     */
    PipelineResult generate(PipelineRequest request, Duration deadline);
}
