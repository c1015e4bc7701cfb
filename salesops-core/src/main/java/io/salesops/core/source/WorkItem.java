package io.salesops.core.source;

import java.nio.charset.StandardCharsets;

public record WorkItem(String key, String owner, String filename, byte[] content) {

    public static WorkItem of(ItemDescriptor descriptor, byte[] content) {
        return new WorkItem(descriptor.key(), descriptor.owner(), descriptor.filename(), content);
    }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
