package io.salesops.core.provider;

import io.salesops.core.model.ChatMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    public List<LlmProvider> chain() {
        return chain;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, double temperature) {
        LlmResponse last = LlmResponse.error("no providers in fallback chain " + name);
        for (LlmProvider provider : chain) {
            last = provider.chat(model, messages, temperature);
            if (!last.isError()) {
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return last;
            }
            LOG.warn(
                "Provider {} failed in chain {}: {}",
                provider.name(),
                name,
                truncate(last.content(), 300)
            );
        }
        return last;
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
