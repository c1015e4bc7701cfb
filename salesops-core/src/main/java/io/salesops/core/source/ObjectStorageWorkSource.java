package io.salesops.core.source;

import io.salesops.core.storage.ObjectStorage;
import io.salesops.core.storage.StoredObject;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Transcripts in an input bucket, one folder per owner. Processed objects are deleted, so anything
 * still listed is unprocessed.
 */
public final class ObjectStorageWorkSource implements WorkSource {
    private final ObjectStorage storage;
    private final String bucket;
    private final String ownerPrefix;
    private final String extension;

    public ObjectStorageWorkSource(ObjectStorage storage, String bucket, String ownerPrefix, String extension) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("input bucket must not be blank");
        }
        this.bucket = bucket;
        this.ownerPrefix = ownerPrefix == null ? "" : ownerPrefix;
        this.extension = extension == null ? "" : extension.toLowerCase();
    }

    @Override
    public List<String> namespaces() throws EnumerationException {
        List<StoredObject> entries = listing("", "root");
        TreeSet<String> owners = new TreeSet<>();
        for (StoredObject entry : entries) {
            if (!entry.folder() && !entry.name().endsWith("/")) {
                continue;
            }
            ObjectKeys.folder(entry.name())
                .filter(name -> name.startsWith(ownerPrefix))
                .ifPresent(owners::add);
        }
        return List.copyOf(owners);
    }

    @Override
    public List<ItemDescriptor> list(String namespace) throws EnumerationException {
        List<ItemDescriptor> items = new ArrayList<>();
        for (StoredObject entry : listing(namespace, namespace)) {
            if (entry.folder()) {
                continue;
            }
            Optional<String> key = ObjectKeys.canonical(namespace, entry.name());
            if (key.isEmpty() || !key.get().toLowerCase().endsWith(extension)) {
                continue;
            }
            items.add(new ItemDescriptor(
                key.get(),
                namespace,
                ObjectKeys.filename(key.get()),
                entry.size(),
                entry.updatedAt()
            ));
        }
        items.sort(Comparator.comparing(ItemDescriptor::key));
        return items;
    }

    @Override
    public byte[] read(String key) throws IOException {
        return storage.download(bucket, key);
    }

    @Override
    public void remove(String key) throws IOException {
        storage.remove(bucket, key);
    }

    @Override
    public IdempotencyMode idempotency() {
        return IdempotencyMode.PRESENCE;
    }

    @Override
    public String describe() {
        return "bucket:" + bucket;
    }

    private List<StoredObject> listing(String prefix, String label) throws EnumerationException {
        try {
            return storage.list(bucket, prefix);
        } catch (IOException | RuntimeException e) {
            throw new EnumerationException("Failed to list " + label + " of bucket " + bucket, e);
        }
    }
}
