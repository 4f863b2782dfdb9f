package io.chatrelay.core.gateway;

import java.time.Duration;

public record RelaySettings(
    String model,
    double temperature,
    int maxTokens,
    Duration timeout
) {
    public static final String DEFAULT_MODEL = "Qwen/Qwen2.5-VL-7B-Instruct";

    public RelaySettings {
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        maxTokens = maxTokens < 1 ? 1024 : maxTokens;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(60) : timeout;
    }

    public static RelaySettings defaults() {
        return new RelaySettings(DEFAULT_MODEL, 0.7, 1024, Duration.ofSeconds(60));
    }
}
