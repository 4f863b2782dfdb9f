package io.chatrelay.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatrelay.core.model.ContentPart;
import io.chatrelay.core.model.MessageContent;
import io.chatrelay.core.model.OutboundMessage;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for OpenAI-compatible {@code /chat/completions} endpoints (OpenAI, Hugging Face router,
 * OpenRouter and the like). One attempt per call; the caller decides what a failure means.
 */
public final class OpenAiCompatProvider implements InferenceProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 500;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, Map.of());
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(InferenceRequest request) throws InferenceException {
        if (apiKey.isBlank()) {
            throw new InferenceException("missing API key for provider " + name);
        }

        Call call = client.newCall(buildRequest(request));
        call.timeout().timeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body == null ? "" : body.string();
                throw new InferenceException("HTTP " + response.code() + " " + truncate(errorBody));
            }
            if (body == null) {
                return "";
            }

            String contentType = response.header("Content-Type", "");
            if (contentType.contains("text/event-stream")) {
                return parseSse(body.source());
            }
            return parseJson(body.string());
        } catch (InterruptedIOException e) {
            LOG.warn("Provider {} timed out after {} ms", name, request.timeout().toMillis());
            throw new InferenceException("request timed out after " + request.timeout().toSeconds() + "s", e);
        } catch (IOException e) {
            throw new InferenceException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
    }

    private Request buildRequest(InferenceRequest request) throws InferenceException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("temperature", request.temperature());
        payload.put("max_tokens", request.maxTokens());
        payload.put("stream", false);

        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (IOException e) {
            throw new InferenceException("failed to encode request: " + e.getMessage(), e);
        }

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<OutboundMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (OutboundMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireValue());
            row.put("content", toWireContent(message.content()));
            wire.add(row);
        }
        return wire;
    }

    private Object toWireContent(MessageContent content) {
        if (content instanceof MessageContent.PlainText plain) {
            return plain.text();
        }
        MessageContent.MultiPart multi = (MessageContent.MultiPart) content;
        List<Map<String, Object>> parts = new ArrayList<>();
        for (ContentPart part : multi.parts()) {
            if (part instanceof ContentPart.Text text) {
                parts.add(Map.of("type", "text", "text", text.text()));
            } else if (part instanceof ContentPart.ImageRef image) {
                parts.add(Map.of("type", "image_url", "image_url", Map.of("url", image.url())));
            }
        }
        return parts;
    }

    private String parseJson(String body) throws InferenceException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new InferenceException("unparseable response body: " + truncate(body), e);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new InferenceException("response contained no choices: " + truncate(body));
        }
        JsonNode content = choices.path(0).path("message").path("content");
        return content.isNull() || content.isMissingNode() ? "" : content.asText("");
    }

    private String parseSse(BufferedSource source) throws IOException, InferenceException {
        StringBuilder content = new StringBuilder();
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }

            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event;
            try {
                event = mapper.readTree(payload);
            } catch (IOException e) {
                throw new InferenceException("unparseable stream event: " + truncate(payload), e);
            }
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    content.append(delta.path("content").asText(""));
                }
            }
        }
        return content.toString();
    }

    private String truncate(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= MAX_ERROR_BODY) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY) + "...";
    }
}
