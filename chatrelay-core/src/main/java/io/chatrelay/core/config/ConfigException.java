package io.chatrelay.core.config;

public final class ConfigException extends IllegalStateException {

    public ConfigException(String message) {
        super(message);
    }
}
