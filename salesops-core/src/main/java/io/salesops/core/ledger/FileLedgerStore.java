package io.salesops.core.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Ledger kept as a JSON array in one file, rewritten atomically on every upsert. */
public final class FileLedgerStore implements LedgerStore {
    private static final TypeReference<List<MemoryRecord>> RECORDS = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;

    public FileLedgerStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Optional<MemoryRecord> find(String key) throws IOException {
        return load().stream().filter(record -> record.path().equals(key)).findFirst();
    }

    @Override
    public synchronized void upsert(MemoryRecord record) throws IOException {
        List<MemoryRecord> records = new ArrayList<>(load());
        records.removeIf(existing -> existing.path().equals(record.path()));
        records.add(record);
        records.sort(Comparator.comparing(MemoryRecord::path));
        save(records);
    }

    @Override
    public synchronized List<MemoryRecord> list() throws IOException {
        return List.copyOf(load());
    }

    private List<MemoryRecord> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return List.of();
        }
        return mapper.readValue(json, RECORDS);
    }

    private void save(List<MemoryRecord> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
