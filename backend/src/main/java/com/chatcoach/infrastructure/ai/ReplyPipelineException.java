package com.chatcoach.infrastructure.ai;

import com.chatcoach.domain.reply.model.ErrorKind;
import com.chatcoach.domain.reply.model.StageKind;
import lombok.Getter;

/**
 * Terminal failure of a pipeline run. Stage results cached before the failure stay valid.
 */
@Getter
public class ReplyPipelineException extends RuntimeException {

    /** Failing stage, null when the run failed before any stage started. */
    private final StageKind stage;
    private final ErrorKind errorKind;

    public ReplyPipelineException(StageKind stage, ErrorKind errorKind, String message) {
        super(message);
        this.stage = stage;
        this.errorKind = errorKind;
    }

    public ReplyPipelineException(StageKind stage, ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.errorKind = errorKind;
    }
}
