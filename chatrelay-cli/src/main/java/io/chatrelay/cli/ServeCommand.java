package io.chatrelay.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the HTTP API (health, new_session, chat, history, track_visit)")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Port override (default from config, 8000)")
    Integer port;

    @Option(names = {"--config"}, description = "Config file (default ~/.chatrelay/config.json)")
    String configFile;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CliContext effective = context.withConfigPath(configFile);
            return effective.gatewayRunner().run(effective.configPath(), port);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
