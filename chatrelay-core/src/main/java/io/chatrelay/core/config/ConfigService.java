package io.chatrelay.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chatrelay.core.config.model.HistoryConfig;
import io.chatrelay.core.config.model.ProviderConfig;
import io.chatrelay.core.config.model.RelayConfig;
import io.chatrelay.core.config.model.ServerConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link RelayConfig}: built-in defaults, deep-merged with an optional JSON file,
 * then overridden by environment variables.
 */
public final class ConfigService {
    public static final String ENV_PROVIDER = "CHATRELAY_PROVIDER";
    public static final String ENV_MODEL = "MODEL_ID";
    public static final String ENV_API_KEY = "HF_TOKEN";
    public static final String ENV_API_BASE = "CHATRELAY_API_BASE";
    public static final String ENV_TIMEOUT_SECONDS = "CHATRELAY_TIMEOUT_SECONDS";
    public static final String ENV_MAX_HISTORY = "CHATRELAY_MAX_HISTORY";
    public static final String ENV_PORT = "CHATRELAY_PORT";
    public static final String ENV_ALLOWED_ORIGINS = "CHATRELAY_ALLOWED_ORIGINS";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public RelayConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return RelayConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(RelayConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, RelayConfig.class);
    }

    public RelayConfig load(Path configPath, Map<String, String> env) throws IOException {
        return applyEnvironment(load(configPath), env);
    }

    public RelayConfig applyEnvironment(RelayConfig config, Map<String, String> env) {
        Objects.requireNonNull(config, "config must not be null");
        if (env == null || env.isEmpty()) {
            return config;
        }

        ProviderConfig provider = config.provider();
        String name = env(env, ENV_PROVIDER);
        if (name != null) {
            provider = provider.withName(name);
        }
        String model = env(env, ENV_MODEL);
        if (model != null) {
            provider = provider.withModel(model);
        }
        String apiKey = env(env, ENV_API_KEY);
        if (apiKey != null) {
            provider = provider.withApiKey(apiKey);
        }
        String apiBase = env(env, ENV_API_BASE);
        if (apiBase != null) {
            provider = provider.withApiBase(apiBase);
        }
        provider = provider.withTimeoutSeconds(intEnv(env, ENV_TIMEOUT_SECONDS, provider.timeoutSeconds()));

        HistoryConfig history = new HistoryConfig(intEnv(env, ENV_MAX_HISTORY, config.history().maxMessages()));

        ServerConfig server = config.server().withPort(intEnv(env, ENV_PORT, config.server().port()));
        String origins = env(env, ENV_ALLOWED_ORIGINS);
        if (origins != null) {
            server = server.withAllowedOrigins(splitList(origins));
        }

        return config.withProvider(provider).withHistory(history).withServer(server);
    }

    /**
     * Fails when the configured provider needs a credential and none is present.
     */
    public void validate(RelayConfig config) {
        ProviderConfig provider = config.provider();
        if (provider.requiresCredential() && !provider.configured()) {
            throw new ConfigException(
                ENV_API_KEY + " is not set. Export an access token for the inference endpoint "
                    + "(or set provider.apiKey in the config file) before starting the server."
            );
        }
        if (provider.model() == null || provider.model().isBlank()) {
            throw new ConfigException("provider.model must not be blank");
        }
    }

    public String toPrettyJson(RelayConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    private static String env(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intEnv(Map<String, String> env, String key, int fallback) {
        String value = env(env, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static List<String> splitList(String raw) {
        List<String> values = new ArrayList<>();
        for (String item : raw.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }
}
