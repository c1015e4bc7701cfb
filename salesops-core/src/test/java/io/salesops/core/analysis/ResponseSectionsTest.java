package io.salesops.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import io.salesops.core.analysis.AnalysisResult.Outcome;
import org.junit.jupiter.api.Test;

class ResponseSectionsTest {

    @Test
    void shouldSplitReportAndSummary() {
        AnalysisResult result = ResponseSections.parse(
            "[REPORT]\n## Audit\nGood rapport.\n[SUMMARY]\nCustomer wants a demo on Friday.",
            "old"
        );

        assertThat(result.outcome()).isEqualTo(Outcome.ANALYZED);
        assertThat(result.report()).isEqualTo("## Audit\nGood rapport.");
        assertThat(result.updatedSummary()).isEqualTo("Customer wants a demo on Friday.");
    }

    @Test
    void shouldFallBackToPreviousSummaryWhenMarkerMissing() {
        AnalysisResult result = ResponseSections.parse("Just a report without sections", "Customer is price sensitive.");

        assertThat(result.outcome()).isEqualTo(Outcome.SUMMARY_MISSING);
        assertThat(result.report()).isEqualTo("Just a report without sections");
        assertThat(result.updatedSummary()).isEqualTo("Customer is price sensitive.");
    }

    @Test
    void shouldUseDefaultSummaryWhenNothingToFallBackTo() {
        AnalysisResult result = ResponseSections.parse("[REPORT] text [SUMMARY]   ", null);

        assertThat(result.outcome()).isEqualTo(Outcome.SUMMARY_MISSING);
        assertThat(result.updatedSummary()).isEqualTo(AnalysisResult.DEFAULT_SUMMARY);
    }

    @Test
    void shouldNeverProduceEmptyReport() {
        AnalysisResult result = ResponseSections.parse("[REPORT]\n[SUMMARY] kept", "old");

        assertThat(result.report()).isEqualTo(AnalysisResult.EMPTY_REPORT);
        assertThat(result.updatedSummary()).isEqualTo("kept");
    }
}
