package io.chatrelay.app;

import io.chatrelay.cli.ChatCommand;
import io.chatrelay.cli.ChatRelayCliCommand;
import io.chatrelay.cli.CliContext;
import io.chatrelay.cli.ServeCommand;
import io.chatrelay.cli.StatusCommand;
import io.chatrelay.core.api.GatewayServer;
import io.chatrelay.core.config.ConfigPaths;
import io.chatrelay.core.config.ConfigService;
import io.chatrelay.core.config.model.RelayConfig;
import io.chatrelay.core.gateway.SessionGateway;
import io.chatrelay.core.provider.InferenceProvider;
import io.chatrelay.core.provider.InferenceProviders;
import io.chatrelay.core.session.InMemoryTranscriptStore;
import io.chatrelay.core.visit.InMemoryVisitTracker;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ChatRelayApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ChatRelayApplication.class);

    private ChatRelayApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Map<String, String> env = System.getenv();
        Path configPath = ConfigPaths.resolve(env.get("CHATRELAY_CONFIG"));

        CliContext context = new CliContext(
            configService,
            configPath,
            env,
            (path, portOverride) -> runGateway(configService, path, env, portOverride)
        );

        CommandLine commandLine = new CommandLine(new ChatRelayCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runGateway(
        ConfigService configService,
        Path configPath,
        Map<String, String> env,
        Integer portOverride
    ) throws Exception {
        RelayConfig config = configService.load(configPath, env);
        configService.validate(config);

        InferenceProvider provider = InferenceProviders.fromConfig(config.provider());
        SessionGateway gateway = new SessionGateway(
            new InMemoryTranscriptStore(config.history().maxMessages()),
            new InMemoryVisitTracker(),
            provider,
            InferenceProviders.settings(config.provider())
        );
        int port = portOverride != null ? portOverride : config.server().port();

        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(
            port,
            config.server().host(),
            gateway,
            config.server().allowedOrigins()
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            LOG.info(
                "ChatRelay serving model {} via {} on http://127.0.0.1:{}",
                config.provider().model(),
                provider.name(),
                server.port()
            );
            System.out.println("Endpoints: GET /health, GET /api/new_session, POST /api/chat, "
                + "GET /api/history?session_id=<id>, POST /api/track_visit");
            shutdown.await();
        }
        return 0;
    }
}
