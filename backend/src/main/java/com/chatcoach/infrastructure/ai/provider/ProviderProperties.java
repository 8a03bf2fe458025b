package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.QualityTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Provider endpoints, bound from {@code chatcoach.providers}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "chatcoach")
public class ProviderProperties {

    @Valid
    private List<Provider> providers = new ArrayList<>();

    @Getter
    @Setter
    public static class Provider {

        @NotBlank
        private String name;

        @NotBlank
        private String baseUrl;

        private String apiKey;

        @NotBlank
        private String textModel;

        /** Empty when the provider has no vision model. */
        private String visionModel;

        /** Optional text model per quality tier, e.g. premium: gpt-4o. */
        private Map<QualityTier, String> tierModels = new EnumMap<>(QualityTier.class);

        private int priority = 100;

        private Duration timeout = Duration.ofSeconds(30);

        private double inputPricePerMillion;

        private double outputPricePerMillion;

        public boolean hasVision() {
            return visionModel != null && !visionModel.isBlank();
        }
    }
}
