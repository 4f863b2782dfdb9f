package io.chatrelay.core.provider;

import io.chatrelay.core.config.ConfigException;
import io.chatrelay.core.config.model.ProviderConfig;
import io.chatrelay.core.gateway.RelaySettings;
import java.time.Duration;
import java.util.Locale;

public final class InferenceProviders {

    private InferenceProviders() {
    }

    public static InferenceProvider fromConfig(ProviderConfig config) {
        String name = config.name() == null ? "" : config.name().trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case ProviderConfig.ECHO -> new EchoProvider(ProviderConfig.ECHO);
            case "", ProviderConfig.OPENAI_COMPAT -> new OpenAiCompatProvider(
                ProviderConfig.OPENAI_COMPAT,
                config.apiKey(),
                config.apiBase(),
                config.extraHeaders()
            );
            default -> throw new ConfigException("Unknown provider: " + config.name());
        };
    }

    public static RelaySettings settings(ProviderConfig config) {
        return new RelaySettings(
            config.model(),
            config.temperature(),
            config.maxTokens(),
            Duration.ofSeconds(Math.max(1, config.timeoutSeconds()))
        );
    }
}
