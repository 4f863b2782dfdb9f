package io.chatrelay.core.gateway;

public final class InferenceFailureException extends ChatRelayException {

    public InferenceFailureException(String detail, Throwable cause) {
        super("Inference error: " + detail, cause);
    }
}
