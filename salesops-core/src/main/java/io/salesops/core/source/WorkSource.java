package io.salesops.core.source;

import java.io.IOException;
import java.util.List;

/**
 * Where transcripts come from. Listings are recomputed from scratch on every call; a source keeps
 * no cursor between cycles.
 */
public interface WorkSource {
    /** Owner namespaces in stable order. */
    List<String> namespaces() throws EnumerationException;

    /** Items directly under {@code namespace}, in stable order. */
    List<ItemDescriptor> list(String namespace) throws EnumerationException;

    byte[] read(String key) throws IOException;

    /** Marks {@code key} as consumed. Sources that keep their inputs do nothing. */
    default void remove(String key) throws IOException {
    }

    IdempotencyMode idempotency();

    /** Human-readable location for logs, e.g. a directory or bucket name. */
    String describe();
}
