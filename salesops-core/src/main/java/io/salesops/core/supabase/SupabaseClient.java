package io.salesops.core.supabase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Thin HTTP helper shared by the Supabase ledger and storage clients. Every request carries the
 * service key both as {@code apikey} and as a bearer token.
 */
public final class SupabaseClient {
    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl baseUrl;
    private final String key;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public SupabaseClient(String baseUrl, String key) {
        this(baseUrl, key, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(30))
            .build(), new ObjectMapper());
    }

    public SupabaseClient(String baseUrl, String key, OkHttpClient client, ObjectMapper mapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Supabase url must not be blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Supabase key must not be blank");
        }
        this.baseUrl = HttpUrl.get(baseUrl);
        this.key = key;
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /** Starts a URL below the project root, e.g. {@code url("rest", "v1", "sales_memory")}. */
    public HttpUrl.Builder url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegments(segment);
        }
        return builder;
    }

    public Request.Builder request(HttpUrl url) {
        return new Request.Builder()
            .url(url)
            .header("apikey", key)
            .header("Authorization", "Bearer " + key);
    }

    public RequestBody json(Object body) throws IOException {
        return RequestBody.create(mapper.writeValueAsString(body), JSON);
    }

    /** Executes the call, failing on any non-2xx status, and returns the raw body bytes. */
    public byte[] execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            byte[] body = response.body() == null ? new byte[0] : response.body().bytes();
            if (!response.isSuccessful()) {
                throw new SupabaseException(
                    response.code(),
                    request.method() + " " + request.url().encodedPath() + " returned HTTP " + response.code()
                        + ": " + truncate(new String(body, StandardCharsets.UTF_8))
                );
            }
            return body;
        }
    }

    public JsonNode executeJson(Request request) throws IOException {
        byte[] body = execute(request);
        if (body.length == 0) {
            return mapper.nullNode();
        }
        return mapper.readTree(body);
    }

    private static String truncate(String value) {
        return value.length() <= 300 ? value : value.substring(0, 300) + "...";
    }
}
