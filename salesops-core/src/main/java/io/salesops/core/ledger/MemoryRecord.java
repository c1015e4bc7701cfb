package io.salesops.core.ledger;

import java.time.Instant;
import java.util.Objects;

public record MemoryRecord(
    String path,
    String owner,
    String lastFingerprint,
    String lastSummary,
    Instant updatedAt
) {
    public MemoryRecord {
        Objects.requireNonNull(path, "path must not be null");
    }

    public MemoryState state() {
        return new MemoryState(lastFingerprint, lastSummary);
    }
}
