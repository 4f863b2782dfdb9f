package io.chatrelay.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatrelay.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ChatCommandIntegrationTest {

    private MockWebServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRelayMessageThroughHttpProvider() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "integration-ok" } }
                  ]
                }
                """));

        Path configPath = writeConfig();
        CliContext context = new CliContext(new ConfigService(), configPath, Map.of("HF_TOKEN", "hf_test"));

        Captured captured = capture(() -> new CommandLine(new ChatCommand(context))
            .execute("hello", "--image", "https://ex.com/a.png"));

        assertThat(captured.code()).isEqualTo(0);
        assertThat(captured.out()).contains("integration-ok");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer hf_test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"test-model\"").contains("\"image_url\"").contains("https://ex.com/a.png");
    }

    @Test
    void shouldFailWithoutCredential() throws Exception {
        CliContext context = new CliContext(new ConfigService(), writeConfig(), Map.of());

        Captured captured = capture(() -> new CommandLine(new ChatCommand(context)).execute("hello"));

        assertThat(captured.code()).isEqualTo(1);
        assertThat(captured.err()).contains("HF_TOKEN");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldReportInvalidImageWithoutCallingProvider() throws Exception {
        CliContext context = new CliContext(new ConfigService(), writeConfig(), Map.of("HF_TOKEN", "hf_test"));

        Captured captured = capture(() -> new CommandLine(new ChatCommand(context))
            .execute("hello", "-i", "ftp://x/y.png"));

        assertThat(captured.code()).isEqualTo(2);
        assertThat(captured.err()).contains("image_urls must be HTTP/HTTPS: ftp://x/y.png");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldLoadConfigFileNamedOnCommandLine() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"from-config-option\"}}]}"));
        String configFile = writeConfig().toString();
        CliContext context = new CliContext(
            new ConfigService(),
            tempDir.resolve("absent.json"),
            Map.of("HF_TOKEN", "hf_test")
        );

        Captured captured = capture(() -> new CommandLine(new ChatCommand(context))
            .execute("hello", "--config", configFile));

        assertThat(captured.code()).isEqualTo(0);
        assertThat(captured.out()).contains("from-config-option");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"model\":\"test-model\"");
    }

    private Path writeConfig() throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "provider": {
                "model": "test-model",
                "apiBase": "%s"
              }
            }
            """.formatted(server.url("/v1/").toString()), StandardCharsets.UTF_8);
        return configPath;
    }

    static Captured capture(CommandRun run) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = run.execute();
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
        return new Captured(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    @FunctionalInterface
    interface CommandRun {
        int execute();
    }

    record Captured(int code, String out, String err) {
    }
}
