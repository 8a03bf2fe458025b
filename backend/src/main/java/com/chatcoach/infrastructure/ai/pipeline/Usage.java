package com.chatcoach.infrastructure.ai.pipeline;

/**
 * Token and cost totals of one or more provider calls.
 */
public record Usage(long inputTokens, long outputTokens, double costUsd) {

    public static final Usage NONE = new Usage(0, 0, 0.0);

    public static Usage of(ProviderFallbackInvoker.ProviderCall call) {
        return new Usage(call.result().promptTokens(), call.result().completionTokens(), call.costUsd());
    }

    public Usage plus(Usage other) {
        return new Usage(inputTokens + other.inputTokens, outputTokens + other.outputTokens, costUsd + other.costUsd);
    }
}
