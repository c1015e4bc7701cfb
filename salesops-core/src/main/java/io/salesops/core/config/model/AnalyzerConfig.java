package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    String provider,
    String model,
    double temperature,
    @JsonAlias({"max_attempts"}) int maxAttempts,
    @JsonAlias({"system_prompt"}) String systemPrompt
) {

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig("deepseek", "deepseek-chat", 0.2, 3, "You are a Sales Ops director auditing sales conversations.");
    }
}
