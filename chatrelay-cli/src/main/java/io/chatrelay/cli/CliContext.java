package io.chatrelay.cli;

import io.chatrelay.core.config.ConfigPaths;
import io.chatrelay.core.config.ConfigService;
import io.chatrelay.core.config.model.RelayConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    GatewayRunner gatewayRunner
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(ConfigService configService, Path configPath, Map<String, String> environment) {
        this(configService, configPath, environment, (path, portOverride) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }

    /**
     * Returns a context reading the given config file, or this context when no path was passed.
     */
    public CliContext withConfigPath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return this;
        }
        return new CliContext(configService, ConfigPaths.resolve(rawPath), environment, gatewayRunner);
    }

    public RelayConfig loadConfig() throws IOException {
        return configService.load(configPath, environment);
    }
}
