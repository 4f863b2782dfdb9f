package io.chatrelay.cli;

import io.chatrelay.core.config.model.RelayConfig;
import io.chatrelay.core.gateway.ChatRelayException;
import io.chatrelay.core.gateway.RelaySettings;
import io.chatrelay.core.gateway.SessionGateway;
import io.chatrelay.core.provider.InferenceProviders;
import io.chatrelay.core.session.InMemoryTranscriptStore;
import io.chatrelay.core.visit.InMemoryVisitTracker;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send one message through a fresh session and print the reply")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = {"-i", "--image"}, description = "HTTP/HTTPS image URL to attach (repeatable)")
    List<String> images = new ArrayList<>();

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"--config"}, description = "Config file (default ~/.chatrelay/config.json)")
    String configFile;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RelayConfig relayConfig = context.withConfigPath(configFile).loadConfig();
            if (model != null && !model.isBlank()) {
                relayConfig = relayConfig.withProvider(relayConfig.provider().withModel(model));
            }
            context.configService().validate(relayConfig);

            RelaySettings settings = InferenceProviders.settings(relayConfig.provider());
            SessionGateway gateway = new SessionGateway(
                new InMemoryTranscriptStore(relayConfig.history().maxMessages()),
                new InMemoryVisitTracker(),
                InferenceProviders.fromConfig(relayConfig.provider()),
                settings
            );

            String session = gateway.newSession();
            System.out.println(gateway.chat(session, message, images));
            return 0;
        } catch (ChatRelayException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
