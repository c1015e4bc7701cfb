package io.salesops.core.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import io.salesops.core.testing.InMemoryLedgerStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class MemoryLedgerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-01T08:30:00Z"), ZoneOffset.UTC);

    @Test
    void shouldReturnWhatWasJustWritten() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        MemoryLedger ledger = new MemoryLedger(store, clock);

        assertThat(ledger.upsert("Vendedor_Ana/cliente1.txt", "Vendedor_Ana", "abc", "summary")).isTrue();

        assertThat(ledger.get("Vendedor_Ana/cliente1.txt")).isEqualTo(new MemoryState("abc", "summary"));
        assertThat(store.get("Vendedor_Ana/cliente1.txt").updatedAt()).isEqualTo(clock.instant());
        assertThat(ledger.size()).isEqualTo(1);
    }

    @Test
    void shouldTreatUnknownPathAsEmpty() {
        MemoryLedger ledger = new MemoryLedger(new InMemoryLedgerStore(), clock);

        MemoryState state = ledger.get("Vendedor_Ana/none.txt");

        assertThat(state).isEqualTo(MemoryState.empty());
        assertThat(state.known()).isFalse();
    }

    @Test
    void shouldDegradeReadFailureToEmptyState() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        store.failReads = true;
        MemoryLedger ledger = new MemoryLedger(store, clock);

        assertThat(ledger.get("Vendedor_Ana/cliente1.txt")).isEqualTo(MemoryState.empty());
        assertThat(ledger.size()).isEqualTo(-1);
    }

    @Test
    void shouldReportWriteFailureWithoutThrowing() {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        store.failWrites = true;
        MemoryLedger ledger = new MemoryLedger(store, clock);

        assertThat(ledger.upsert("Vendedor_Ana/cliente1.txt", "Vendedor_Ana", "abc", "summary")).isFalse();
    }
}
