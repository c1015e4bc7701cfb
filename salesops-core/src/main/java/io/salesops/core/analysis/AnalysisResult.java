package io.salesops.core.analysis;

public record AnalysisResult(String report, String updatedSummary, Outcome outcome) {
    public static final String FAILED_REPORT = "Analysis failed; the transcript will be retried.";
    public static final String EMPTY_REPORT = "The model returned no report content.";
    public static final String DEFAULT_SUMMARY = "No summary available.";

    public enum Outcome {
        /** Both the report and the summary sections were present. */
        ANALYZED,
        /** The summary section was missing or empty; the summary fell back to the previous one. */
        SUMMARY_MISSING,
        /** The provider call failed; nothing should be persisted. */
        FAILED
    }

    public static AnalysisResult failed(String previousSummary) {
        return new AnalysisResult(FAILED_REPORT, previousSummary, Outcome.FAILED);
    }

    public boolean succeeded() {
        return outcome != Outcome.FAILED;
    }
}
