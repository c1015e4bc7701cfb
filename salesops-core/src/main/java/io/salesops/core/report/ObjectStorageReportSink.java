package io.salesops.core.report;

import io.salesops.core.storage.ObjectStorage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;

/** Uploads {@code REPORT_<owner>_<filename>_<epochMillis>.md} to the output bucket. */
public final class ObjectStorageReportSink implements ReportSink {
    static final String CONTENT_TYPE = "text/markdown";

    private final ObjectStorage storage;
    private final String bucket;
    private final Clock clock;

    public ObjectStorageReportSink(ObjectStorage storage, String bucket, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("output bucket must not be blank");
        }
        this.bucket = bucket;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String write(String owner, String sourceFilename, String content) throws IOException {
        String name = "REPORT_" + owner + "_" + sourceFilename + "_" + clock.millis() + ".md";
        storage.upload(bucket, name, content.getBytes(StandardCharsets.UTF_8), CONTENT_TYPE);
        return bucket + "/" + name;
    }
}
