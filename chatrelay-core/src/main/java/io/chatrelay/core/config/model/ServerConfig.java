package io.chatrelay.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(
    String host,
    int port,
    @JsonAlias({"allowed_origins"}) List<String> allowedOrigins
) {

    public ServerConfig {
        host = host == null || host.isBlank() ? "0.0.0.0" : host;
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    }

    public static ServerConfig defaults() {
        return new ServerConfig(
            "0.0.0.0",
            8000,
            List.of("http://127.0.0.1:5500", "http://localhost:5500")
        );
    }

    public ServerConfig withPort(int value) {
        return new ServerConfig(host, value, allowedOrigins);
    }

    public ServerConfig withAllowedOrigins(List<String> value) {
        return new ServerConfig(host, port, value);
    }
}
