package io.salesops.core.dispatch;

import java.time.Duration;
import java.time.Instant;

public record CycleReport(
    Instant startedAt,
    Instant finishedAt,
    int discovered,
    int processed,
    int skipped,
    int failed,
    boolean enumerationFailed
) {

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
