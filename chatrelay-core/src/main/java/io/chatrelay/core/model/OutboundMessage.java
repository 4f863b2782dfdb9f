package io.chatrelay.core.model;

import java.util.Objects;

public record OutboundMessage(MessageRole role, MessageContent content) {

    public OutboundMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static OutboundMessage of(Turn turn) {
        return new OutboundMessage(turn.role(), new MessageContent.PlainText(turn.content()));
    }

    public static OutboundMessage user(String text) {
        return new OutboundMessage(MessageRole.USER, new MessageContent.PlainText(text));
    }
}
