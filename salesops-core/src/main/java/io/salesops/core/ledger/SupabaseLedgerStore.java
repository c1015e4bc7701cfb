package io.salesops.core.ledger;

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
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.Request;

/** Ledger table behind Supabase's PostgREST API, keyed by {@code file_path}. */
public final class SupabaseLedgerStore implements LedgerStore {
    private static final String COLUMNS = "file_path,salesperson,last_hash,last_summary,updated_at";

    private final SupabaseClient client;
    private final String table;

    public SupabaseLedgerStore(SupabaseClient client, String table) {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be blank");
        }
        this.client = client;
        this.table = table;
    }

    @Override
    public Optional<MemoryRecord> find(String path) throws IOException {
        HttpUrl url = client.url("rest/v1", table)
            .addQueryParameter("select", COLUMNS)
            .addQueryParameter("file_path", "eq." + path)
            .build();
        JsonNode rows = client.executeJson(client.request(url).get().build());
        if (!rows.isArray() || rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(read(rows.get(0)));
    }

    @Override
    public void upsert(MemoryRecord record) throws IOException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("file_path", record.path());
        row.put("salesperson", record.owner());
        row.put("last_hash", record.lastFingerprint());
        row.put("last_summary", record.lastSummary());
        row.put("updated_at", record.updatedAt() == null ? null : record.updatedAt().toString());

        HttpUrl url = client.url("rest/v1", table)
            .addQueryParameter("on_conflict", "file_path")
            .build();
        Request request = client.request(url)
            .header("Prefer", "resolution=merge-duplicates,return=minimal")
            .post(client.json(List.of(row)))
            .build();
        client.execute(request);
    }

    @Override
    public List<MemoryRecord> list() throws IOException {
        HttpUrl url = client.url("rest/v1", table)
            .addQueryParameter("select", COLUMNS)
            .addQueryParameter("order", "file_path.asc")
            .build();
        JsonNode rows = client.executeJson(client.request(url).get().build());
        List<MemoryRecord> records = new ArrayList<>();
        for (JsonNode row : rows) {
            records.add(read(row));
        }
        return records;
    }

    private MemoryRecord read(JsonNode row) {
        String updatedAt = text(row, "updated_at");
        return new MemoryRecord(
            row.path("file_path").asText(),
            text(row, "salesperson"),
            text(row, "last_hash"),
            text(row, "last_summary"),
            updatedAt == null ? null : parseInstant(updatedAt)
        );
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.path(field);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            // Postgres timestamptz renders with an offset rather than Z.
            return OffsetDateTime.parse(value).toInstant();
        }
    }
}
