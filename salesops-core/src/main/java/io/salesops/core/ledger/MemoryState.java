package io.salesops.core.ledger;

/** What the ledger last saw for a path. Both fields are null when nothing is known. */
public record MemoryState(String fingerprint, String summary) {
    private static final MemoryState EMPTY = new MemoryState(null, null);

    public static MemoryState empty() {
        return EMPTY;
    }

    public boolean known() {
        return fingerprint != null || summary != null;
    }
}
