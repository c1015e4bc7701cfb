package io.salesops.core.ledger;

import io.salesops.core.supabase.SupabaseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-soft view over a {@link LedgerStore}.
 *
 * <p>Reads never throw: any lookup failure is logged and reported as {@link MemoryState#empty()},
 * so an unreachable ledger degrades to reprocessing instead of stalling the poll loop. Writes are
 * best-effort bookkeeping: failures are logged and reported through the return value.
 */
public final class MemoryLedger {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryLedger.class);

    private final LedgerStore store;
    private final Clock clock;

    public MemoryLedger(LedgerStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public MemoryState get(String path) {
        try {
            return store.find(path).map(MemoryRecord::state).orElse(MemoryState.empty());
        } catch (Exception e) {
            LOG.warn("event=ledger.read_failed path={} error={}", path, e.getMessage());
            return MemoryState.empty();
        }
    }

    public boolean upsert(String path, String owner, String fingerprint, String summary) {
        MemoryRecord record = new MemoryRecord(path, owner, fingerprint, summary, Instant.now(clock));
        try {
            store.upsert(record);
            return true;
        } catch (SupabaseException e) {
            LOG.error("event=ledger.write_failed path={} status={} error={}", path, e.status(), e.getMessage(), e);
            return false;
        } catch (Exception e) {
            LOG.error("event=ledger.write_failed path={} error={}", path, e.getMessage(), e);
            return false;
        }
    }

    /** Number of records, or -1 when the store cannot be read. */
    public int size() {
        try {
            return store.list().size();
        } catch (Exception e) {
            LOG.warn("event=ledger.list_failed error={}", e.getMessage());
            return -1;
        }
    }
}
