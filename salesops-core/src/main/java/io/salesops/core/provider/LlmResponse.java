package io.salesops.core.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LlmResponse(String content, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public static LlmResponse error(String detail) {
        return new LlmResponse(ERROR_PREFIX + " " + detail, Map.of());
    }

    public static LlmResponse error(String detail, Map<String, Object> usage) {
        return new LlmResponse(ERROR_PREFIX + " " + detail, usage);
    }

    public boolean isError() {
        return content.startsWith(ERROR_PREFIX);
    }
}
