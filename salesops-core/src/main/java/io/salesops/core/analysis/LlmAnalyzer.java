package io.salesops.core.analysis;

import io.salesops.core.model.ChatMessage;
import io.salesops.core.provider.LlmProvider;
import io.salesops.core.provider.LlmResponse;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmAnalyzer implements Analyzer {
    private static final Logger LOG = LoggerFactory.getLogger(LlmAnalyzer.class);

    static final String INSTRUCTIONS = """
        Audit the sales conversation below.
        Reply with exactly two sections, in this order:
        [REPORT]
        A markdown audit: what went well, missed opportunities, objections and how they were handled,
        and concrete next steps for the salesperson.
        [SUMMARY]
        A short running summary of the whole relationship with this customer so far, written so it can
        be given back to you as context next time the conversation grows.
        """;

    private final LlmProvider provider;
    private final String model;
    private final double temperature;
    private final String systemPrompt;

    public LlmAnalyzer(LlmProvider provider, String model, double temperature, String systemPrompt) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.temperature = temperature;
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }

    @Override
    public AnalysisResult analyze(String owner, String filename, String text, String previousSummary) {
        List<ChatMessage> messages = List.of(
            ChatMessage.system(systemPrompt),
            ChatMessage.user(buildPrompt(owner, filename, text, previousSummary))
        );
        LlmResponse response;
        try {
            response = provider.chat(model, messages, temperature);
        } catch (RuntimeException e) {
            LOG.error("event=analysis.error owner={} file={} provider={}", owner, filename, provider.name(), e);
            return AnalysisResult.failed(previousSummary);
        }
        if (response == null || response.isError()) {
            LOG.warn(
                "event=analysis.error owner={} file={} provider={} error={}",
                owner,
                filename,
                provider.name(),
                response == null ? "null response" : truncate(response.content())
            );
            return AnalysisResult.failed(previousSummary);
        }
        AnalysisResult result = ResponseSections.parse(response.content(), previousSummary);
        if (result.outcome() == AnalysisResult.Outcome.SUMMARY_MISSING) {
            LOG.warn("event=analysis.summary_missing owner={} file={}", owner, filename);
        }
        return result;
    }

    static String buildPrompt(String owner, String filename, String text, String previousSummary) {
        StringBuilder prompt = new StringBuilder();
        if (previousSummary != null && !previousSummary.isBlank()) {
            prompt.append("Context from earlier analyses of this conversation:\n")
                .append(previousSummary.trim())
                .append("\n\n");
        }
        prompt.append("Salesperson: ").append(owner).append('\n');
        prompt.append("File: ").append(filename).append("\n\n");
        prompt.append(INSTRUCTIONS).append('\n');
        prompt.append("Conversation:\n").append(text == null ? "" : text);
        return prompt.toString();
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 300 ? value : value.substring(0, 300) + "...";
    }
}
