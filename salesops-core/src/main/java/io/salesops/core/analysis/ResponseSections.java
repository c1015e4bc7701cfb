package io.salesops.core.analysis;

import io.salesops.core.analysis.AnalysisResult.Outcome;

/** Splits a model reply of the form {@code [REPORT] ... [SUMMARY] ...}. */
public final class ResponseSections {
    public static final String REPORT_MARKER = "[REPORT]";
    public static final String SUMMARY_MARKER = "[SUMMARY]";

    private ResponseSections() {
    }

    public static AnalysisResult parse(String reply, String previousSummary) {
        String text = reply == null ? "" : reply;
        int split = text.lastIndexOf(SUMMARY_MARKER);

        String reportPart = split < 0 ? text : text.substring(0, split);
        String summaryPart = split < 0 ? "" : text.substring(split + SUMMARY_MARKER.length()).trim();

        String report = reportPart.replace(REPORT_MARKER, "").trim();
        if (report.isEmpty()) {
            report = AnalysisResult.EMPTY_REPORT;
        }
        if (summaryPart.isEmpty()) {
            return new AnalysisResult(report, fallbackSummary(previousSummary), Outcome.SUMMARY_MISSING);
        }
        return new AnalysisResult(report, summaryPart, Outcome.ANALYZED);
    }

    static String fallbackSummary(String previousSummary) {
        return previousSummary == null || previousSummary.isBlank()
            ? AnalysisResult.DEFAULT_SUMMARY
            : previousSummary;
    }
}
