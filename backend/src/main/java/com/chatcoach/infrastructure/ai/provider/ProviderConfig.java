package com.chatcoach.infrastructure.ai.provider;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfig {

    @Bean
    public ProviderRegistry providerRegistry(ProviderProperties properties) {
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (ProviderProperties.Provider provider : properties.getProviders()) {
            adapters.add(new OpenAiCompatibleProviderAdapter(provider, openAIClient(provider)));
            log.info("Registered provider {} (priority={}, text={}, vision={})",
                    provider.getName(), provider.getPriority(), provider.getTextModel(),
                    provider.hasVision() ? provider.getVisionModel() : "-");
        }
        if (adapters.isEmpty()) {
            log.warn("No LLM providers configured under chatcoach.providers");
        }
        ProviderRegistry registry = new ProviderRegistry(adapters);
        log.info("Provider fallback order: {}", registry.all().stream().map(ProviderAdapter::name).toList());
        return registry;
    }

    private OpenAIClient openAIClient(ProviderProperties.Provider provider) {
        // Fallback across providers is done by the orchestrator, so SDK retries stay off.
        return OpenAIOkHttpClient.builder()
                .apiKey(provider.getApiKey() != null ? provider.getApiKey() : "")
                .baseUrl(provider.getBaseUrl())
                .timeout(provider.getTimeout())
                .maxRetries(0)
                .build();
    }
}
