package io.salesops.core.ledger;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface LedgerStore {
    Optional<MemoryRecord> find(String path) throws IOException;

    /** Inserts or replaces the record keyed by {@link MemoryRecord#path()}. */
    void upsert(MemoryRecord record) throws IOException;

    List<MemoryRecord> list() throws IOException;
}
