package io.chatrelay.core.provider;

import io.chatrelay.core.model.OutboundMessage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record InferenceRequest(
    String model,
    List<OutboundMessage> messages,
    double temperature,
    int maxTokens,
    Duration timeout
) {
    public InferenceRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        maxTokens = Math.max(1, maxTokens);
        timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
    }
}
