package io.chatrelay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryConfig(@JsonProperty("maxMessages") @JsonAlias({"max_messages"}) int maxMessages) {

    public HistoryConfig {
        maxMessages = maxMessages < 1 ? 30 : maxMessages;
    }

    public static HistoryConfig defaults() {
        return new HistoryConfig(30);
    }
}
