package io.salesops.core.provider;

import io.salesops.core.model.ChatMessage;
import java.util.List;

/**
 * A hosted chat model. Implementations never throw for transport or provider failures;
 * they return an {@link LlmResponse} whose content starts with {@link LlmResponse#ERROR_PREFIX}.
 */
public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages, double temperature);
}
