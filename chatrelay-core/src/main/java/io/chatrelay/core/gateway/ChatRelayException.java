package io.chatrelay.core.gateway;

public abstract class ChatRelayException extends RuntimeException {

    protected ChatRelayException(String message) {
        super(message);
    }

    protected ChatRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
