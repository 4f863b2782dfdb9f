package io.chatrelay.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chatrelay.core.config.model.RelayConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        RelayConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.provider().model()).isEqualTo("Qwen/Qwen2.5-VL-7B-Instruct");
        assertThat(config.provider().apiBase()).isEqualTo("https://router.huggingface.co/v1");
        assertThat(config.provider().timeoutSeconds()).isEqualTo(60);
        assertThat(config.provider().configured()).isFalse();
        assertThat(config.history().maxMessages()).isEqualTo(30);
        assertThat(config.server().allowedOrigins()).contains("http://localhost:5500");
    }

    @Test
    void shouldMergeFileValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "provider": {
                "model": "meta-llama/Llama-3.2-11B-Vision-Instruct",
                "apiKey": "hf_file"
              },
              "history": {
                "max_messages": 10
              }
            }
            """);

        RelayConfig config = service.load(configPath);

        assertThat(config.provider().model()).isEqualTo("meta-llama/Llama-3.2-11B-Vision-Instruct");
        assertThat(config.provider().apiKey()).isEqualTo("hf_file");
        assertThat(config.provider().maxTokens()).isEqualTo(1024);
        assertThat(config.history().maxMessages()).isEqualTo(10);
        assertThat(config.server().port()).isEqualTo(8000);
    }

    @Test
    void environmentShouldOverrideFileAndDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"provider\":{\"model\":\"from-file\"}}");

        RelayConfig config = service.load(configPath, Map.of(
            "MODEL_ID", "from-env",
            "HF_TOKEN", "hf_env",
            "CHATRELAY_PORT", "9100",
            "CHATRELAY_MAX_HISTORY", "12",
            "CHATRELAY_TIMEOUT_SECONDS", "not-a-number",
            "CHATRELAY_ALLOWED_ORIGINS", "https://a.example, https://b.example,"
        ));

        assertThat(config.provider().model()).isEqualTo("from-env");
        assertThat(config.provider().apiKey()).isEqualTo("hf_env");
        assertThat(config.provider().timeoutSeconds()).isEqualTo(60);
        assertThat(config.server().port()).isEqualTo(9100);
        assertThat(config.history().maxMessages()).isEqualTo(12);
        assertThat(config.server().allowedOrigins()).containsExactly("https://a.example", "https://b.example");
    }

    @Test
    void validateShouldRejectMissingCredential() {
        ConfigService service = new ConfigService();

        assertThatThrownBy(() -> service.validate(RelayConfig.defaults()))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("HF_TOKEN");
    }

    @Test
    void validateShouldAllowEchoProviderWithoutCredential() {
        ConfigService service = new ConfigService();
        RelayConfig config = service.applyEnvironment(RelayConfig.defaults(), Map.of("CHATRELAY_PROVIDER", "echo"));

        service.validate(config);

        assertThat(config.provider().requiresCredential()).isFalse();
    }
}
