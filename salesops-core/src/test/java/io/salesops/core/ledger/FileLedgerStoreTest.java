package io.salesops.core.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileLedgerStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUpsertAndFindByPath() throws Exception {
        FileLedgerStore store = new FileLedgerStore(tempDir.resolve("ledger/memory.json"));
        Instant now = Instant.parse("2026-01-10T12:00:00Z");

        store.upsert(new MemoryRecord("Vendedor_Ana/cliente1.txt", "Vendedor_Ana", "h1", "first", now));
        store.upsert(new MemoryRecord("Vendedor_Ana/cliente1.txt", "Vendedor_Ana", "h2", "second", now.plusSeconds(60)));
        store.upsert(new MemoryRecord("Vendedor_Bruno/x.txt", "Vendedor_Bruno", "h3", "other", now));

        MemoryRecord record = store.find("Vendedor_Ana/cliente1.txt").orElseThrow();
        assertThat(record.lastFingerprint()).isEqualTo("h2");
        assertThat(record.lastSummary()).isEqualTo("second");
        assertThat(record.updatedAt()).isEqualTo(now.plusSeconds(60));
        assertThat(store.list()).extracting(MemoryRecord::path)
            .containsExactly("Vendedor_Ana/cliente1.txt", "Vendedor_Bruno/x.txt");
        assertThat(store.find("missing.txt")).isEmpty();
    }

    @Test
    void shouldSurviveReopen() throws Exception {
        Path file = tempDir.resolve("memory.json");
        new FileLedgerStore(file).upsert(new MemoryRecord("a/b.txt", "a", "h", "s", Instant.EPOCH));

        assertThat(new FileLedgerStore(file).find("a/b.txt")).map(MemoryRecord::lastSummary).contains("s");
        assertThat(Files.exists(tempDir.resolve("memory.json.tmp"))).isFalse();
    }

    @Test
    void shouldFailOnCorruptFile() throws Exception {
        Path file = tempDir.resolve("memory.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new FileLedgerStore(file).find("a/b.txt")).isInstanceOf(IOException.class);
    }
}
