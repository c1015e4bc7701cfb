package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig deepseek,
    ProviderConfig openai,
    ProviderConfig openrouter
) {
    public static final String DEFAULT_DEEPSEEK_BASE = "https://api.deepseek.com";
    public static final String DEFAULT_OPENAI_BASE = "https://api.openai.com/v1";
    public static final String DEFAULT_OPENROUTER_BASE = "https://openrouter.ai/api/v1";

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
    }

    /** Providers in fallback order, keyed by name. */
    public Map<String, ProviderConfig> byName() {
        Map<String, ProviderConfig> all = new LinkedHashMap<>();
        all.put("deepseek", deepseek);
        all.put("openai", openai);
        all.put("openrouter", openrouter);
        return all;
    }

    public static String defaultBase(String name) {
        return switch (name) {
            case "deepseek" -> DEFAULT_DEEPSEEK_BASE;
            case "openai" -> DEFAULT_OPENAI_BASE;
            case "openrouter" -> DEFAULT_OPENROUTER_BASE;
            default -> throw new IllegalArgumentException("Unknown provider: " + name);
        };
    }
}
