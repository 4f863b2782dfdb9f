package io.chatrelay.core.gateway;

public final class InvalidImageReferenceException extends ChatRelayException {
    private final String reference;

    public InvalidImageReferenceException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
