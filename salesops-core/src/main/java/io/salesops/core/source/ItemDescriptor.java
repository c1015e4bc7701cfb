package io.salesops.core.source;

import java.time.Instant;

/** A listed, not yet read, work item. {@code key} is always {@code owner/filename}. */
public record ItemDescriptor(String key, String owner, String filename, long size, Instant modifiedAt) {
}
