package io.chatrelay.core.model;

import java.util.Objects;

/**
 * One stored message of a transcript. Content is always plain text, even when the
 * request sent upstream for this turn carried image parts.
 */
public record Turn(MessageRole role, String content) {

    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
    }

    public static Turn user(String content) {
        return new Turn(MessageRole.USER, content);
    }

    public static Turn assistant(String content) {
        return new Turn(MessageRole.ASSISTANT, content);
    }
}
