package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.ContextAnalysis;
import com.chatcoach.domain.reply.model.SceneAnalysis;
import com.chatcoach.domain.reply.model.StageResult;

public record AnalysisBundle(StageResult<ContextAnalysis> context, StageResult<SceneAnalysis> scene) {}
