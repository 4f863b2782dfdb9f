package io.chatrelay.core.model;

public record HistoryEntry(String sender, String text) {
    public static final String USER_LABEL = "You";
    public static final String ASSISTANT_LABEL = "AI";

    public static HistoryEntry of(Turn turn) {
        String sender = switch (turn.role()) {
            case USER -> USER_LABEL;
            case ASSISTANT -> ASSISTANT_LABEL;
        };
        return new HistoryEntry(sender, turn.content());
    }
}
