package io.chatrelay.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface GatewayRunner {
    int run(Path configPath, Integer portOverride) throws Exception;
}
