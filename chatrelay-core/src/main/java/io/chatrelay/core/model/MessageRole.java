package io.chatrelay.core.model;

public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireValue;

    MessageRole(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
