package io.salesops.core.storage;

import java.io.IOException;
import java.util.List;

public interface ObjectStorage {
    /** Lists the direct children of {@code prefix} (empty for the bucket root). */
    List<StoredObject> list(String bucket, String prefix) throws IOException;

    byte[] download(String bucket, String key) throws IOException;

    void upload(String bucket, String key, byte[] content, String contentType) throws IOException;

    void remove(String bucket, String key) throws IOException;
}
