package io.chatrelay.cli;

import picocli.CommandLine.Command;

@Command(name = "chatrelay", mixinStandardHelpOptions = true, description = "Session-scoped chat relay for OpenAI-compatible models")
public final class ChatRelayCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
