package io.salesops.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.salesops.core.supabase.SupabaseClient;
import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

/** Supabase Storage REST API. */
public final class SupabaseStorageClient implements ObjectStorage {
    static final int PAGE_SIZE = 100;

    private final SupabaseClient client;

    public SupabaseStorageClient(SupabaseClient client) {
        this.client = client;
    }

    @Override
    public List<StoredObject> list(String bucket, String prefix) throws IOException {
        List<StoredObject> objects = new ArrayList<>();
        int offset = 0;
        while (true) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("prefix", prefix == null ? "" : prefix);
            body.put("limit", PAGE_SIZE);
            body.put("offset", offset);
            body.put("sortBy", Map.of("column", "name", "order", "asc"));

            HttpUrl url = client.url("storage/v1/object/list", bucket).build();
            JsonNode page = client.executeJson(client.request(url).post(client.json(body)).build());
            if (!page.isArray()) {
                throw new IOException("Unexpected listing payload for bucket " + bucket + ": " + page.getNodeType());
            }
            for (JsonNode entry : page) {
                objects.add(toStoredObject(entry));
            }
            if (page.size() < PAGE_SIZE) {
                return objects;
            }
            offset += PAGE_SIZE;
        }
    }

    @Override
    public byte[] download(String bucket, String key) throws IOException {
        HttpUrl url = client.url("storage/v1/object", bucket, key).build();
        return client.execute(client.request(url).get().build());
    }

    @Override
    public void upload(String bucket, String key, byte[] content, String contentType) throws IOException {
        HttpUrl url = client.url("storage/v1/object", bucket, key).build();
        Request request = client.request(url)
            .post(RequestBody.create(content, MediaType.get(contentType)))
            .build();
        client.execute(request);
    }

    @Override
    public void remove(String bucket, String key) throws IOException {
        HttpUrl url = client.url("storage/v1/object", bucket).build();
        Request request = client.request(url)
            .delete(client.json(Map.of("prefixes", List.of(key))))
            .build();
        client.execute(request);
    }

    private StoredObject toStoredObject(JsonNode entry) {
        String name = entry.path("name").asText("");
        JsonNode id = entry.path("id");
        if (id.isMissingNode() || id.isNull()) {
            return StoredObject.folder(name);
        }
        long size = entry.path("metadata").path("size").asLong(0L);
        return StoredObject.file(name, size, parseInstant(entry.path("updated_at").asText(null)));
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
