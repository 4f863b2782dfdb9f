package io.chatrelay.core.provider;

import io.chatrelay.core.model.ContentPart;
import io.chatrelay.core.model.MessageContent;
import io.chatrelay.core.model.MessageRole;
import io.chatrelay.core.model.OutboundMessage;

/**
 * Offline provider that answers with the newest user text. Useful for local runs without a credential.
 */
public final class EchoProvider implements InferenceProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(InferenceRequest request) {
        String lastUserMessage = request.messages().stream()
            .filter(message -> message.role() == MessageRole.USER)
            .reduce((first, second) -> second)
            .map(OutboundMessage::content)
            .map(EchoProvider::textOf)
            .orElse("");

        return "[" + name + "] " + lastUserMessage;
    }

    private static String textOf(MessageContent content) {
        if (content instanceof MessageContent.PlainText plain) {
            return plain.text();
        }
        MessageContent.MultiPart multi = (MessageContent.MultiPart) content;
        for (ContentPart part : multi.parts()) {
            if (part instanceof ContentPart.Text text) {
                return text.text();
            }
        }
        return "";
    }
}
