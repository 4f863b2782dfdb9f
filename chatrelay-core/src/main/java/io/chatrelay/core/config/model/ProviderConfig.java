package io.chatrelay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    String name,
    String model,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    double temperature,
    @JsonAlias({"max_tokens"}) int maxTokens,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {
    public static final String OPENAI_COMPAT = "openai_compat";
    public static final String ECHO = "echo";

    public ProviderConfig {
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig(
            OPENAI_COMPAT,
            "Qwen/Qwen2.5-VL-7B-Instruct",
            "",
            "https://router.huggingface.co/v1",
            0.7,
            1024,
            60,
            Map.of()
        );
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean requiresCredential() {
        return !ECHO.equalsIgnoreCase(name);
    }

    public ProviderConfig withName(String value) {
        return new ProviderConfig(value, model, apiKey, apiBase, temperature, maxTokens, timeoutSeconds, extraHeaders);
    }

    public ProviderConfig withModel(String value) {
        return new ProviderConfig(name, value, apiKey, apiBase, temperature, maxTokens, timeoutSeconds, extraHeaders);
    }

    public ProviderConfig withApiKey(String value) {
        return new ProviderConfig(name, model, value, apiBase, temperature, maxTokens, timeoutSeconds, extraHeaders);
    }

    public ProviderConfig withApiBase(String value) {
        return new ProviderConfig(name, model, apiKey, value, temperature, maxTokens, timeoutSeconds, extraHeaders);
    }

    public ProviderConfig withTimeoutSeconds(int value) {
        return new ProviderConfig(name, model, apiKey, apiBase, temperature, maxTokens, value, extraHeaders);
    }
}
