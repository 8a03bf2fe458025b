package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.PipelineRequest;
import com.chatcoach.domain.reply.model.StageKind;

import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one request travelling through the pipeline.
 */
public final class PipelineRun {

    private final PipelineRequest request;
    private final Deadline deadline;
    private final AtomicReference<StageKind> lastStarted = new AtomicReference<>();

    public PipelineRun(PipelineRequest request, Deadline deadline) {
        this.request = request;
        this.deadline = deadline;
    }

    public PipelineRequest request() {
        return request;
    }

    public String requestId() {
        return request.requestId();
    }

    public Deadline deadline() {
        return deadline;
    }

    void started(StageKind stage) {
        lastStarted.set(stage);
    }

    /**
     * Most recently started stage, null before the first stage.
     */
    StageKind lastStarted() {
        return lastStarted.get();
    }
}
