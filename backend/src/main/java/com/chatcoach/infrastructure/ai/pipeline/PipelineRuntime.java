package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.infrastructure.ai.cache.StageCache;
import com.chatcoach.infrastructure.ai.extraction.FailedOutputStore;
import com.chatcoach.infrastructure.ai.provider.ProviderRegistry;
import com.chatcoach.infrastructure.trace.TraceCollector;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Process-scoped collaborators shared by every pipeline run. The stage cache is the only mutable state.
 */
public record PipelineRuntime(
        StageCache cache,
        ProviderRegistry registry,
        TraceCollector trace,
        FailedOutputStore failedOutputs,
        Executor executor,
        Duration cacheTtl
) {}
