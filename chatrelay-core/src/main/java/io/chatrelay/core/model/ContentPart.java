package io.chatrelay.core.model;

import java.util.Objects;

public sealed interface ContentPart permits ContentPart.Text, ContentPart.ImageRef {

    record Text(String text) implements ContentPart {
        public Text {
            text = text == null ? "" : text;
        }
    }

    record ImageRef(String url) implements ContentPart {
        public ImageRef {
            Objects.requireNonNull(url, "url must not be null");
        }
    }
}
