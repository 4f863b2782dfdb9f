package io.chatrelay.core.model;

import java.util.List;

/**
 * Body of an outbound message: either the plain text mirrored from the transcript, or a
 * structured list of parts built for the newest user turn.
 */
public sealed interface MessageContent permits MessageContent.PlainText, MessageContent.MultiPart {

    record PlainText(String text) implements MessageContent {
        public PlainText {
            text = text == null ? "" : text;
        }
    }

    record MultiPart(List<ContentPart> parts) implements MessageContent {
        public MultiPart {
            parts = parts == null ? List.of() : List.copyOf(parts);
        }
    }
}
