package io.chatrelay.cli;

import io.chatrelay.core.config.model.RelayConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--config"}, description = "Config file (default ~/.chatrelay/config.json)")
    String configFile;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CliContext effective = context.withConfigPath(configFile);
            RelayConfig config = effective.loadConfig();
            System.out.println("Config path: " + effective.configPath());
            System.out.println("Config exists: " + Files.exists(effective.configPath()));
            System.out.println("Provider: " + config.provider().name());
            System.out.println("Model: " + config.provider().model());
            System.out.println("API base: " + config.provider().apiBase());
            System.out.println("Credential configured: " + config.provider().configured());
            System.out.println("Timeout (s): " + config.provider().timeoutSeconds());
            System.out.println("History limit: " + config.history().maxMessages());
            System.out.println("Listen: " + config.server().host() + ":" + config.server().port());
            System.out.println("Allowed origins: " + String.join(", ", config.server().allowedOrigins()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
