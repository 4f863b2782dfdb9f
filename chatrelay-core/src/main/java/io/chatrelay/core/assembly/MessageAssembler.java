package io.chatrelay.core.assembly;

import io.chatrelay.core.model.ContentPart;
import io.chatrelay.core.model.MessageContent;
import io.chatrelay.core.model.MessageRole;
import io.chatrelay.core.model.OutboundMessage;
import io.chatrelay.core.model.Turn;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the message list sent to the inference endpoint from a stored transcript.
 * Only the newest user turn may become multi-part, and only for the outbound copy.
 */
public final class MessageAssembler {

    public AssemblyResult build(List<Turn> transcript, String newUserText, List<String> imageRefs) {
        List<OutboundMessage> outbound = new ArrayList<>();
        if (transcript != null) {
            for (Turn turn : transcript) {
                outbound.add(OutboundMessage.of(turn));
            }
        }

        if (imageRefs == null || imageRefs.isEmpty()) {
            return new AssemblyResult.Assembled(outbound);
        }

        Optional<String> invalid = ImageReferences.firstInvalid(imageRefs);
        if (invalid.isPresent()) {
            return new AssemblyResult.Rejected(
                invalid.get(),
                "image_urls must be HTTP/HTTPS: " + invalid.get()
            );
        }

        if (outbound.isEmpty() || outbound.get(outbound.size() - 1).role() != MessageRole.USER) {
            outbound.add(OutboundMessage.user(newUserText));
        }

        List<ContentPart> parts = new ArrayList<>(imageRefs.size() + 1);
        parts.add(new ContentPart.Text(newUserText));
        for (String ref : imageRefs) {
            parts.add(new ContentPart.ImageRef(ref));
        }
        outbound.set(
            outbound.size() - 1,
            new OutboundMessage(MessageRole.USER, new MessageContent.MultiPart(parts))
        );
        return new AssemblyResult.Assembled(outbound);
    }
}
