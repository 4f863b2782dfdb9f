package io.chatrelay.core.assembly;

import io.chatrelay.core.model.OutboundMessage;
import java.util.List;

public sealed interface AssemblyResult permits AssemblyResult.Assembled, AssemblyResult.Rejected {

    record Assembled(List<OutboundMessage> messages) implements AssemblyResult {
        public Assembled {
            messages = List.copyOf(messages);
        }
    }

    record Rejected(String invalidReference, String reason) implements AssemblyResult {
    }
}
