package io.salesops.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import io.salesops.core.fingerprint.ContentFingerprinter;
import io.salesops.core.ledger.MemoryLedger;
import io.salesops.core.report.ObjectStorageReportSink;
import io.salesops.core.source.ObjectStorageWorkSource;
import io.salesops.core.testing.InMemoryLedgerStore;
import io.salesops.core.testing.InMemoryObjectStorage;
import io.salesops.core.testing.MutableClock;
import io.salesops.core.testing.ScriptedAnalyzer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PollLoopTest {

    private static final Duration POLL = Duration.ofSeconds(10);
    private static final Duration BACKOFF = Duration.ofSeconds(30);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
    private final InMemoryObjectStorage storage = new InMemoryObjectStorage();

    @Test
    void shouldWaitPollIntervalAfterHealthyCycleAndBackoffAfterOutage() {
        List<Duration> waits = new ArrayList<>();
        PollLoop loop = new PollLoop(dispatcher(), POLL, BACKOFF, clock, delay -> {
            waits.add(delay);
            storage.failListing = !storage.failListing;
            return waits.size() == 3;
        });

        loop.run();

        assertThat(waits).containsExactly(POLL, BACKOFF, POLL);
        assertThat(loop.lastReport()).hasValueSatisfying(report -> assertThat(report.enumerationFailed()).isFalse());
    }

    @Test
    void shouldProcessWorkEachCycle() {
        storage.put("sales-logs", "Vendedor_Ana/cliente1.txt", "hola");
        PollLoop loop = new PollLoop(dispatcher(), POLL, BACKOFF, clock, delay -> true);

        loop.run();

        assertThat(storage.bucket("sales-logs")).isEmpty();
        assertThat(loop.lastReport()).hasValueSatisfying(report -> assertThat(report.processed()).isEqualTo(1));
    }

    @Test
    void stopShouldEndTheWaitEarly() throws Exception {
        PollLoop loop = new PollLoop(dispatcher(), Duration.ofHours(1), Duration.ofHours(1), clock);
        Thread worker = new Thread(loop::run, "poll-loop-test");
        worker.start();

        while (loop.lastReport().isEmpty()) {
            Thread.sleep(10);
        }
        loop.stop();

        assertThat(loop.awaitTermination(Duration.ofSeconds(5))).isTrue();
        worker.join(5_000);
        assertThat(worker.isAlive()).isFalse();
    }

    @Test
    void nextDelayShouldFollowEnumerationOutcome() {
        PollLoop loop = new PollLoop(dispatcher(), POLL, BACKOFF, clock);
        Instant now = clock.instant();

        assertThat(loop.nextDelay(new CycleReport(now, now, 0, 0, 0, 0, false))).isEqualTo(POLL);
        assertThat(loop.nextDelay(new CycleReport(now, now, 0, 0, 0, 0, true))).isEqualTo(BACKOFF);
    }

    private Dispatcher dispatcher() {
        return new Dispatcher(
            new ObjectStorageWorkSource(storage, "sales-logs", "Vendedor_", ".txt"),
            ScriptedAnalyzer.echoing(),
            new ObjectStorageReportSink(storage, "sales-reports", clock),
            new MemoryLedger(new InMemoryLedgerStore(), clock),
            new ContentFingerprinter(),
            clock
        );
    }
}
