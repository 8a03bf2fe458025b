package com.chatcoach.domain.reply.model;

import java.util.List;

/**
 * Final output: the reply plus every stage result that produced it, in dependency order.
 */
public record PipelineResult(
        String replyText,
        String provider,
        String model,
        List<StageResult<?>> stages,
        long totalInputTokens,
        long totalOutputTokens,
        double totalCostUsd,
        long totalLatencyMs
) {

    public static PipelineResult assemble(StageResult<ReplyDraft> reply,
                                          List<StageResult<?>> stages,
                                          long totalLatencyMs) {
        long input = 0;
        long output = 0;
        double cost = 0;
        for (StageResult<?> stage : stages) {
            if (stage.fromCache()) {
                continue;
            }
            input += stage.inputTokens();
            output += stage.outputTokens();
            cost += stage.costUsd();
        }
        return new PipelineResult(reply.payload().text(), reply.provider(), reply.model(),
                List.copyOf(stages), input, output, cost, totalLatencyMs);
    }

    public boolean servedFromCache(StageKind kind) {
        return stages.stream().anyMatch(s -> s.kind() == kind && s.fromCache());
    }
}
