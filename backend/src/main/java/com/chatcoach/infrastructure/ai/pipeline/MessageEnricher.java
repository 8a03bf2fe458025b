package com.chatcoach.infrastructure.ai.pipeline;

import com.chatcoach.domain.reply.model.DialogEntry;
import com.chatcoach.domain.reply.model.StageKind;
import com.chatcoach.infrastructure.ai.LlmPrompt;
import com.chatcoach.infrastructure.ai.preprocessing.TextNormalizer;
import com.chatcoach.infrastructure.ai.provider.CallOptions;
import com.chatcoach.infrastructure.ai.provider.Capability;
import com.chatcoach.infrastructure.ai.provider.CapabilityUnsupportedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Prepares the conversation for context analysis. Every message is processed in parallel:
 * text is normalized, image URLs are described through a vision provider and replaced by
 * {@code [image] <description>}. Results are re-assembled in the original order.
 */
@Slf4j
public class MessageEnricher {

    static final String IMAGE_PREFIX = "[image] ";

    /**
     * Enriched messages plus the usage of the vision calls made for them.
     */
    public record EnrichedConversation(List<DialogEntry> entries, Usage usage) {}

    private record EnrichedEntry(DialogEntry entry, Usage usage) {}

    private final ProviderFallbackInvoker invoker;
    private final TextNormalizer normalizer;
    private final StagePromptBuilder prompts;
    private final Executor executor;

    public MessageEnricher(ProviderFallbackInvoker invoker,
                           TextNormalizer normalizer,
                           StagePromptBuilder prompts,
                           Executor executor) {
        this.invoker = invoker;
        this.normalizer = normalizer;
        this.prompts = prompts;
        this.executor = executor;
    }

    public CompletableFuture<EnrichedConversation> enrich(PipelineRun run, List<DialogEntry> dialogs) {
        List<CompletableFuture<EnrichedEntry>> tasks = new ArrayList<>(dialogs.size());
        for (DialogEntry entry : dialogs) {
            tasks.add(entry.isImage()
                    ? describe(run, entry)
                    : CompletableFuture.supplyAsync(() -> new EnrichedEntry(normalizer.normalize(entry), Usage.NONE), executor));
        }
        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    List<DialogEntry> entries = new ArrayList<>(tasks.size());
                    Usage usage = Usage.NONE;
                    // tasks is indexed like dialogs, so completion order does not matter
                    for (CompletableFuture<EnrichedEntry> task : tasks) {
                        EnrichedEntry enriched = task.join();
                        entries.add(enriched.entry());
                        usage = usage.plus(enriched.usage());
                    }
                    return new EnrichedConversation(entries, usage);
                });
    }

    private CompletableFuture<EnrichedEntry> describe(PipelineRun run, DialogEntry entry) {
        String url = entry.text().strip();
        LlmPrompt prompt = prompts.imageDescription(run.request().language());
        CallOptions options = CallOptions.text(run.request().quality(), 0.2, 200);
        return invoker.invoke(run, StageKind.CONTEXT_ANALYSIS, Capability.VISION,
                        adapter -> adapter.callVision(prompt, url, options))
                .thenApply(call -> new EnrichedEntry(
                        entry.withText(IMAGE_PREFIX + normalizer.normalize(call.result().content())),
                        Usage.of(call)))
                .exceptionally(error -> {
                    if (ProviderFallbackInvoker.unwrap(error) instanceof CapabilityUnsupportedException) {
                        log.warn("[Enricher] No vision provider for inline image in request {}, keeping placeholder",
                                run.requestId());
                        return new EnrichedEntry(entry.withText(IMAGE_PREFIX.strip()), Usage.NONE);
                    }
                    throw ProviderFallbackInvoker.propagate(error);
                });
    }
}
