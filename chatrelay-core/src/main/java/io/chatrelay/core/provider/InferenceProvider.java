package io.chatrelay.core.provider;

public interface InferenceProvider {
    String name();

    String complete(InferenceRequest request) throws InferenceException;
}
