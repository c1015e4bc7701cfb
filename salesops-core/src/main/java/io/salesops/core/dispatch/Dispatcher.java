package io.salesops.core.dispatch;

import io.salesops.core.analysis.AnalysisResult;
import io.salesops.core.analysis.Analyzer;
import io.salesops.core.fingerprint.ContentFingerprinter;
import io.salesops.core.ledger.MemoryLedger;
import io.salesops.core.ledger.MemoryState;
import io.salesops.core.report.ReportSink;
import io.salesops.core.source.EnumerationException;
import io.salesops.core.source.IdempotencyMode;
import io.salesops.core.source.ItemDescriptor;
import io.salesops.core.source.WorkItem;
import io.salesops.core.source.WorkSource;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pass over the work source: enumerate, filter to new work, analyze, write the report, then
 * record the result in the ledger. Items are handled one at a time in listing order.
 *
 * <p>The ledger is only advanced after the report has been written, and a failed analysis leaves
 * every store untouched so the item is picked up again next cycle. Not thread-safe: exactly one
 * dispatcher may serve a given source.
 */
public final class Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final WorkSource source;
    private final Analyzer analyzer;
    private final ReportSink sink;
    private final MemoryLedger ledger;
    private final ContentFingerprinter fingerprinter;
    private final Clock clock;

    public Dispatcher(
        WorkSource source,
        Analyzer analyzer,
        ReportSink sink,
        MemoryLedger ledger,
        ContentFingerprinter fingerprinter,
        Clock clock
    ) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CycleReport runCycle() {
        Instant startedAt = clock.instant();
        int discovered = 0;
        int processed = 0;
        int skipped = 0;
        int failed = 0;

        try {
            for (String namespace : source.namespaces()) {
                List<ItemDescriptor> items = source.list(namespace);
                for (ItemDescriptor item : items) {
                    discovered++;
                    LOG.info("event=item.discovered key={} size={}", item.key(), item.size());
                    switch (process(item)) {
                        case PROCESSED -> processed++;
                        case SKIPPED -> skipped++;
                        case FAILED -> failed++;
                    }
                }
            }
        } catch (EnumerationException e) {
            LOG.error("event=cycle.aborted source={} error={}", source.describe(), e.getMessage(), e);
            return new CycleReport(startedAt, clock.instant(), discovered, processed, skipped, failed, true);
        }
        return new CycleReport(startedAt, clock.instant(), discovered, processed, skipped, failed, false);
    }

    private ItemOutcome process(ItemDescriptor descriptor) {
        String key = descriptor.key();
        try {
            WorkItem item = WorkItem.of(descriptor, source.read(key));
            String digest = fingerprinter.fingerprint(item.content());
            MemoryState prior = ledger.get(key);

            if (source.idempotency() == IdempotencyMode.CONTENT_HASH && !fingerprinter.hasChanged(prior, digest)) {
                LOG.debug("event=item.skipped key={} reason=unchanged", key);
                return ItemOutcome.SKIPPED;
            }

            LOG.info("event=analysis.started key={} priorSummary={}", key, prior.summary() != null);
            AnalysisResult result = analyzer.analyze(item.owner(), item.filename(), item.text(), prior.summary());
            if (!result.succeeded()) {
                LOG.warn("event=item.failed key={} reason=analysis_failed", key);
                return ItemOutcome.FAILED;
            }

            String location = sink.write(item.owner(), item.filename(), result.report());
            boolean recorded = ledger.upsert(key, item.owner(), digest, result.updatedSummary());
            source.remove(key);

            LOG.info(
                "event=item.processed key={} report={} outcome={} ledgerUpdated={}",
                key,
                location,
                result.outcome(),
                recorded
            );
            return ItemOutcome.PROCESSED;
        } catch (Exception e) {
            LOG.error("event=item.failed key={} error={}", key, e.getMessage(), e);
            return ItemOutcome.FAILED;
        }
    }

    private enum ItemOutcome {
        PROCESSED,
        SKIPPED,
        FAILED
    }
}
