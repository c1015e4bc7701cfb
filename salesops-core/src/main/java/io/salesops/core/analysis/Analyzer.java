package io.salesops.core.analysis;

/**
 * Turns one transcript plus the running summary into a report and a new summary. Implementations
 * do not throw; failures come back as {@link AnalysisResult.Outcome#FAILED}.
 */
public interface Analyzer {
    AnalysisResult analyze(String owner, String filename, String text, String previousSummary);
}
