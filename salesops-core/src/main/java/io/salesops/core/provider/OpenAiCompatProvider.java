package io.salesops.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.salesops.core.model.ChatMessage;
import io.salesops.core.model.MessageRole;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat-completions client for OpenAI-compatible endpoints (DeepSeek, OpenAI, OpenRouter).
 *
 * <p>Transient failures (HTTP 429, HTTP 5xx, I/O errors) are retried with bounded exponential
 * backoff. Any other non-2xx status, or a 2xx body that cannot be parsed, is returned as an error
 * response without sending the request again.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long INITIAL_DELAY_MS = 250;
    private static final long MAX_DELAY_MS = 2000;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders
    ) {
        this(name, apiKey, apiBase, extraHeaders, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
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
    public LlmResponse chat(String model, List<ChatMessage> messages, double temperature) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name);
        }

        long delayMs = INITIAL_DELAY_MS;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request request = buildRequest(model, messages, temperature);
                try (Response response = client.newCall(request).execute()) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            LOG.debug("Provider {} returned HTTP {} on attempt {}, retrying", name, response.code(), attempt);
                            sleep(delayMs);
                            delayMs = Math.min(delayMs * 2, MAX_DELAY_MS);
                            continue;
                        }
                        return LlmResponse.error(
                            "HTTP " + response.code() + " " + errorBody,
                            Map.of("http_status", response.code())
                        );
                    }

                    ResponseBody body = response.body();
                    if (body == null) {
                        return new LlmResponse("", Map.of());
                    }
                    return parseJson(body.string());
                }
            } catch (JsonProcessingException jpe) {
                LOG.warn("Provider {} returned an unreadable completion: {}", name, jpe.getOriginalMessage());
                return LlmResponse.error("unreadable completion: " + jpe.getOriginalMessage());
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    LOG.debug("Provider {} I/O failure on attempt {}: {}", name, attempt, ioe.getMessage());
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, MAX_DELAY_MS);
                    continue;
                }
                return LlmResponse.error(String.valueOf(ioe.getMessage()));
            } catch (Exception e) {
                return LlmResponse.error(String.valueOf(e.getMessage()));
            }
        }
        return LlmResponse.error("exhausted retries");
    }

    private Request buildRequest(String model, List<ChatMessage> messages, double temperature) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        payload.put("temperature", temperature);
        payload.put("stream", false);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");

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

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    private LlmResponse parseJson(String body) throws JsonProcessingException {
        JsonNode root = mapper.readTree(body);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            return LlmResponse.error(error.path("message").asText(error.toString()));
        }
        JsonNode message = root.path("choices").path(0).path("message");
        String content = message.path("content").asText("");
        return new LlmResponse(content, usageAsMap(root.path("usage")));
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, new TypeReference<Map<String, Object>>() {
        });
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
