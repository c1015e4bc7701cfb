package io.salesops.core.report;

import java.io.IOException;

public interface ReportSink {
    /**
     * Stores a report for {@code sourceFilename} and returns where it went. Each call produces a new
     * location; earlier reports are never overwritten.
     */
    String write(String owner, String sourceFilename, String content) throws IOException;
}
