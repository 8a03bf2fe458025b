package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.infrastructure.ai.cache.CacheMetricsTracker;
import com.chatcoach.infrastructure.ai.cache.CaffeineStageCache;
import com.chatcoach.infrastructure.ai.cache.StageCache;
import com.chatcoach.infrastructure.ai.extraction.FailedOutputStore;
import com.chatcoach.infrastructure.ai.extraction.FileFailedOutputStore;
import com.chatcoach.infrastructure.ai.extraction.ResilientJsonExtractor;
import com.chatcoach.infrastructure.ai.extraction.StagePayloadMapper;
import com.chatcoach.infrastructure.ai.preprocessing.TextNormalizer;
import com.chatcoach.infrastructure.ai.provider.ProviderRegistry;
import com.chatcoach.infrastructure.trace.TraceCollector;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(PipelineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getWorkerPoolSize(), r -> {
            Thread t = new Thread(r, "pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public CacheMetricsTracker cacheMetricsTracker() {
        return new CacheMetricsTracker();
    }

    @Bean
    public StageCache stageCache(PipelineProperties properties, CacheMetricsTracker metrics) {
        log.info("Stage cache: maxSize={}, ttl={}", properties.getCacheMaxSize(), properties.getCacheTtl());
        return new CaffeineStageCache(properties.getCacheMaxSize(), metrics);
    }

    @Bean
    public FailedOutputStore failedOutputStore(PipelineProperties properties, ObjectMapper objectMapper) {
        return new FileFailedOutputStore(Path.of(properties.getFailedOutputDir()), objectMapper);
    }

    @Bean
    public ResilientJsonExtractor resilientJsonExtractor(ObjectMapper objectMapper,
                                                         FailedOutputStore failedOutputStore,
                                                         PipelineProperties properties) {
        return new ResilientJsonExtractor(objectMapper, failedOutputStore, properties.getExcerptLength());
    }

    @Bean
    public PipelineRuntime pipelineRuntime(StageCache stageCache,
                                           ProviderRegistry providerRegistry,
                                           TraceCollector traceCollector,
                                           FailedOutputStore failedOutputStore,
                                           ExecutorService pipelineExecutor,
                                           PipelineProperties properties) {
        return new PipelineRuntime(stageCache, providerRegistry, traceCollector, failedOutputStore,
                pipelineExecutor, properties.getCacheTtl());
    }

    @Bean
    public ProviderFallbackInvoker providerFallbackInvoker(PipelineRuntime pipelineRuntime) {
        return new ProviderFallbackInvoker(pipelineRuntime);
    }

    @Bean
    public StageExecutor stageExecutor(PipelineRuntime pipelineRuntime,
                                       ProviderFallbackInvoker providerFallbackInvoker,
                                       ResilientJsonExtractor resilientJsonExtractor) {
        return new StageExecutor(pipelineRuntime, providerFallbackInvoker, resilientJsonExtractor);
    }

    @Bean
    public MessageEnricher messageEnricher(ProviderFallbackInvoker providerFallbackInvoker,
                                           TextNormalizer textNormalizer,
                                           StagePromptBuilder stagePromptBuilder,
                                           ExecutorService pipelineExecutor) {
        return new MessageEnricher(providerFallbackInvoker, textNormalizer, stagePromptBuilder, pipelineExecutor);
    }

    @Bean
    public TraditionalStrategy traditionalStrategy(StageExecutor stageExecutor,
                                                   MessageEnricher messageEnricher,
                                                   StagePromptBuilder stagePromptBuilder,
                                                   StagePayloadMapper stagePayloadMapper,
                                                   TextNormalizer textNormalizer) {
        return new TraditionalStrategy(stageExecutor, messageEnricher, stagePromptBuilder,
                stagePayloadMapper, textNormalizer);
    }

    @Bean
    public MergedStrategy mergedStrategy(StageExecutor stageExecutor,
                                         MessageEnricher messageEnricher,
                                         StagePromptBuilder stagePromptBuilder,
                                         StagePayloadMapper stagePayloadMapper) {
        return new MergedStrategy(stageExecutor, messageEnricher, stagePromptBuilder, stagePayloadMapper);
    }
}
