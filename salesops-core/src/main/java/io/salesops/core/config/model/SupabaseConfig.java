package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SupabaseConfig(
    String url,
    @JsonAlias({"api_key", "apiKey"}) String key
) {

    public static SupabaseConfig defaults() {
        return new SupabaseConfig("", "");
    }

    public boolean configured() {
        return url != null && !url.isBlank() && key != null && !key.isBlank();
    }
}
