package io.salesops.core.storage;

import java.time.Instant;

/**
 * One entry of a bucket listing. {@code name} is exactly what the backend returned: Supabase
 * Storage answers with bare names, S3 with full keys.
 */
public record StoredObject(String name, boolean folder, long size, Instant updatedAt) {

    public static StoredObject folder(String name) {
        return new StoredObject(name, true, 0L, null);
    }

    public static StoredObject file(String name, long size, Instant updatedAt) {
        return new StoredObject(name, false, size, updatedAt);
    }
}
