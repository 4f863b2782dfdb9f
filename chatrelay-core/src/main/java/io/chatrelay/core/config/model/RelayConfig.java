package io.chatrelay.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayConfig(
    ProviderConfig provider,
    HistoryConfig history,
    ServerConfig server
) {

    public static RelayConfig defaults() {
        return new RelayConfig(
            ProviderConfig.defaults(),
            HistoryConfig.defaults(),
            ServerConfig.defaults()
        );
    }

    public RelayConfig withProvider(ProviderConfig provider) {
        return new RelayConfig(provider, history, server);
    }

    public RelayConfig withHistory(HistoryConfig history) {
        return new RelayConfig(provider, history, server);
    }

    public RelayConfig withServer(ServerConfig server) {
        return new RelayConfig(provider, history, server);
    }
}
