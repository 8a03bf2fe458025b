package com.chatcoach.application.reply;

import com.chatcoach.domain.reply.model.FlowStrategy;
import com.chatcoach.domain.reply.model.PipelineRequest;
import com.chatcoach.domain.reply.model.PipelineResult;
import com.chatcoach.domain.reply.service.ReplyService;
import com.chatcoach.infrastructure.ai.pipeline.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for any transport: validates requests and applies configured defaults
 * before handing them to the {@link ReplyService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReplyAppService {

    private final ReplyService replyService;
    private final PipelineProperties pipelineProperties;

    public PipelineResult generate(PipelineRequest request) {
        return generate(request, null);
    }

    /**
     * @param deadline budget for the whole run, null for the configured default
     */
    public PipelineResult generate(PipelineRequest request, Duration deadline) {
        PipelineRequest prepared = prepare(request);
        return replyService.generate(prepared, effectiveDeadline(deadline));
    }

    public CompletableFuture<PipelineResult> generateAsync(PipelineRequest request, Duration deadline) {
        PipelineRequest prepared = prepare(request);
        return replyService.generateAsync(prepared, effectiveDeadline(deadline));
    }

    PipelineRequest prepare(PipelineRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request is required");
        }
        if (request.userId() == null || request.userId().isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (request.dialogs().isEmpty() && !request.hasImage()) {
            throw new IllegalArgumentException("Either a conversation or a screenshot is required");
        }
        int maxDialogs = pipelineProperties.getMaxDialogs();
        if (request.dialogs().size() > maxDialogs) {
            throw new IllegalArgumentException(
                    String.format("At most %d dialog entries are accepted, got %d", maxDialogs, request.dialogs().size()));
        }
        if (request.language() == null || request.language().isBlank()) {
            throw new IllegalArgumentException("language is required");
        }
        if (request.quality() == null) {
            throw new IllegalArgumentException("quality is required");
        }

        PipelineRequest prepared = request;
        if (prepared.requestId() == null || prepared.requestId().isBlank()) {
            prepared = new PipelineRequest(UUID.randomUUID().toString(), prepared.userId(), prepared.targetId(),
                    prepared.conversationId(), prepared.dialogs(), prepared.language(), prepared.quality(),
                    prepared.imageRef(), prepared.strategy());
        }
        if (prepared.strategy() == null) {
            FlowStrategy fallback = pipelineProperties.getDefaultStrategy();
            prepared = prepared.withStrategy(fallback);
        }
        log.debug("Prepared request {} (flow={}, quality={})",
                prepared.requestId(), prepared.strategy(), prepared.quality());
        return prepared;
    }

    private Duration effectiveDeadline(Duration deadline) {
        if (deadline == null) {
            return pipelineProperties.getDeadline();
        }
        if (deadline.isZero() || deadline.isNegative()) {
            throw new IllegalArgumentException("deadline must be positive");
        }
        return deadline;
    }
}
