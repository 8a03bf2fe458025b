package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.infrastructure.ai.LlmCallResult;
import com.chatcoach.infrastructure.ai.LlmPrompt;
import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.errors.RateLimitException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;

import java.io.InterruptedIOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Adapter for any backend exposing the OpenAI chat completions API
 * (OpenAI, OpenRouter, DashScope compatible mode, ...).
 */
@Slf4j
public class OpenAiCompatibleProviderAdapter implements ProviderAdapter {

    private static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int DEFAULT_MAX_TOKENS = 1024;

    private final ProviderProperties.Provider config;
    private final OpenAIClient openAIClient;
    private final Set<Capability> capabilities;

    public OpenAiCompatibleProviderAdapter(ProviderProperties.Provider config, OpenAIClient openAIClient) {
        this.config = config;
        this.openAIClient = openAIClient;
        this.capabilities = config.hasVision()
                ? EnumSet.of(Capability.TEXT, Capability.VISION)
                : EnumSet.of(Capability.TEXT);
    }

    @Override
    public String name() {
        return config.getName();
    }

    @Override
    public int priority() {
        return config.getPriority();
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public LlmCallResult callText(LlmPrompt prompt, CallOptions options) {
        String model = resolveTextModel(options);
        var builder = baseParams(model, options)
                .addSystemMessage(prompt.systemPrompt())
                .addUserMessage(prompt.userMessage());
        return execute(model, builder.build());
    }

    @Override
    public LlmCallResult callVision(LlmPrompt prompt, String imageRef, CallOptions options) {
        if (!config.hasVision()) {
            throw new CapabilityUnsupportedException(name(), "Provider " + name() + " has no vision model");
        }
        String model = options.model() != null ? options.model() : config.getVisionModel();

        List<ChatCompletionContentPart> parts = List.of(
                ChatCompletionContentPart.ofText(ChatCompletionContentPartText.builder()
                        .text(prompt.userMessage())
                        .build()),
                ChatCompletionContentPart.ofImageUrl(ChatCompletionContentPartImage.builder()
                        .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder()
                                .url(imageRef)
                                .build())
                        .build()));

        var builder = baseParams(model, options)
                .addSystemMessage(prompt.systemPrompt())
                .addUserMessageOfArrayOfContentParts(parts);
        return execute(model, builder.build());
    }

    @Override
    public double costUsd(long inputTokens, long outputTokens) {
        return (inputTokens * config.getInputPricePerMillion()
                + outputTokens * config.getOutputPricePerMillion()) / 1_000_000.0;
    }

    private String resolveTextModel(CallOptions options) {
        if (options.model() != null) {
            return options.model();
        }
        if (options.quality() != null && config.getTierModels().containsKey(options.quality())) {
            return config.getTierModels().get(options.quality());
        }
        return config.getTextModel();
    }

    private ChatCompletionCreateParams.Builder baseParams(String model, CallOptions options) {
        var builder = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(options.temperature() != null ? options.temperature() : DEFAULT_TEMPERATURE)
                .maxCompletionTokens(options.maxTokens() != null ? options.maxTokens() : DEFAULT_MAX_TOKENS);

        if (options.jsonResponse()) {
            builder.responseFormat(ResponseFormatJsonObject.builder().build());
        }
        return builder;
    }

    private LlmCallResult execute(String model, ChatCompletionCreateParams params) {
        ChatCompletion completion;
        try {
            completion = openAIClient.chat().completions().create(params);
        } catch (RuntimeException e) {
            throw translate(model, e);
        }

        long promptTokens = 0;
        long completionTokens = 0;
        if (completion.usage().isPresent()) {
            var usage = completion.usage().get();
            promptTokens = usage.promptTokens();
            completionTokens = usage.completionTokens();
            log.debug("Token usage [{}/{}] - prompt: {}, completion: {}, total: {}",
                    name(), model, promptTokens, completionTokens, usage.totalTokens());
        }

        String content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElseThrow(() -> new ProviderUnavailableException(name(),
                        "Provider " + name() + " returned no content"));

        return new LlmCallResult(content.trim(), name(), model, promptTokens, completionTokens);
    }

    ProviderException translate(String model, RuntimeException e) {
        if (e instanceof RateLimitException) {
            log.warn("[{}] Rate limited on model {}", name(), model);
            return new ProviderRateLimitedException(name(), "Rate limited by " + name(), e);
        }
        if (e instanceof OpenAIServiceException se) {
            int status = se.statusCode();
            if (status == 401 || status == 403 || status == 408 || status >= 500) {
                log.warn("[{}] Upstream status {} on model {}", name(), status, model);
                return new ProviderUnavailableException(name(), name() + " answered HTTP " + status, e);
            }
            return new ProviderRequestException(name(), name() + " rejected the request with HTTP " + status, e);
        }
        if (e instanceof OpenAIIoException) {
            if (hasCause(e, InterruptedIOException.class)) {
                return new ProviderTimeoutException(name(), name() + " timed out", e);
            }
            return new ProviderUnavailableException(name(), name() + " is unreachable", e);
        }
        log.error("[{}] Unexpected failure on model {}", name(), model, e);
        return new ProviderRequestException(name(), "Unexpected failure calling " + name(), e);
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }
}
