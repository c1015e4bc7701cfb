package io.salesops.core.source;

/** How a source keeps the dispatcher from analyzing the same input twice. */
public enum IdempotencyMode {
    /** Inputs stay in place; unchanged bytes are recognized by their fingerprint. */
    CONTENT_HASH,
    /** Inputs are removed after processing; whatever is still listed is new work. */
    PRESENCE
}
