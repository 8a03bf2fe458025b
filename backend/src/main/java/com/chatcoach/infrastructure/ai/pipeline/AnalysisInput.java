package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.infrastructure.ai.cache.CacheKey;

import java.util.List;

/**
 * What both flows analyse. Keys are derived once by the orchestrator so the two flows
 * always read and write the same cache entries.
 *
 * @param conversation       request dialogs followed by the dialogs recognised in the screenshot
 * @param screenshotScenario scenario detected in the screenshot, null without one
 */
public record AnalysisInput(
        List<DialogEntry> conversation,
        String screenshotScenario,
        CacheKey contextKey,
        CacheKey sceneKey
) {}
