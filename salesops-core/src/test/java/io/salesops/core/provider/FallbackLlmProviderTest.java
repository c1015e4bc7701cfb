package io.salesops.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.salesops.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FallbackLlmProviderTest {

    @Test
    void shouldUseNextProviderWhenFirstFails() {
        LlmProvider primary = new StubProvider("primary", "Error calling LLM: timeout");
        LlmProvider secondary = new StubProvider("secondary", "ok");

        FallbackLlmProvider provider = new FallbackLlmProvider("deepseek", List.of(primary, secondary));

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")), 0.2);

        assertThat(response.content()).isEqualTo("ok");
    }

    @Test
    void shouldReturnLastErrorWhenEveryProviderFails() {
        FallbackLlmProvider provider = new FallbackLlmProvider(
            "deepseek",
            List.of(new DisabledProvider("deepseek", "missing API key"), new StubProvider("openai", "Error calling LLM: 503"))
        );

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")), 0.2);

        assertThat(response.isError()).isTrue();
        assertThat(response.content()).endsWith("503");
    }

    private record StubProvider(String name, String content) implements LlmProvider {
        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, double temperature) {
            return new LlmResponse(content, Map.of());
        }
    }
}
