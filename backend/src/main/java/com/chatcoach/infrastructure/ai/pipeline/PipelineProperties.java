package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.FlowStrategy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "chatcoach.pipeline")
public class PipelineProperties {

    @NotNull
    private FlowStrategy defaultStrategy = FlowStrategy.TRADITIONAL;

    /** Budget for one whole pipeline run when the caller supplies none. */
    @NotNull
    private Duration deadline = Duration.ofSeconds(60);

    @NotNull
    private Duration cacheTtl = Duration.ofHours(24);

    @Min(1)
    private long cacheMaxSize = 10_000;

    @Min(1)
    private int workerPoolSize = 8;

    @NotNull
    private String failedOutputDir = "failed_json_replies";

    @Min(20)
    private int excerptLength = 200;

    /** Longest conversation accepted per request. */
    @Min(1)
    private int maxDialogs = 200;
}
