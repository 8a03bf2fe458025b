package com.chatcoach.infrastructure.ai.pipeline;

public class PipelineTimeoutException extends RuntimeException {

    public PipelineTimeoutException(String message) {
        super(message);
    }
}
