package com.chatcoach.infrastructure.ai.provider;

import java.util.Comparator;
import java.util.List;

/**
 * Immutable set of configured adapters, ordered by priority rank.
 */
public class ProviderRegistry {

    private final List<ProviderAdapter> adapters;

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        this.adapters = adapters.stream()
                .sorted(Comparator.comparingInt(ProviderAdapter::priority)
                        .thenComparing(ProviderAdapter::name))
                .toList();
    }

    /**
     * Adapters declaring the capability, in rank order.
     */
    public List<ProviderAdapter> candidates(Capability capability) {
        return adapters.stream()
                .filter(a -> a.supports(capability))
                .toList();
    }

    public List<ProviderAdapter> all() {
        return adapters;
    }
}
