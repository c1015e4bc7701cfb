package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WatchConfig(
    String mode,
    @JsonAlias({"poll_interval_seconds"}) int pollIntervalSeconds,
    @JsonAlias({"backoff_seconds"}) int backoffSeconds,
    String extension,
    @JsonAlias({"owner_prefix"}) String ownerPrefix
) {
    public static final String MODE_LOCAL = "local";
    public static final String MODE_REMOTE = "remote";

    public static WatchConfig defaults() {
        return new WatchConfig(MODE_LOCAL, 10, 30, ".txt", "Vendedor_");
    }

    public boolean remote() {
        return MODE_REMOTE.equals(normalizedMode());
    }

    public String normalizedMode() {
        String value = mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
        if (!MODE_LOCAL.equals(value) && !MODE_REMOTE.equals(value)) {
            throw new IllegalArgumentException("Unknown watch mode: " + mode + " (expected local or remote)");
        }
        return value;
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(Math.max(1, pollIntervalSeconds));
    }

    public Duration backoff() {
        return Duration.ofSeconds(Math.max(1, backoffSeconds));
    }

    public WatchConfig withMode(String value) {
        return new WatchConfig(value, pollIntervalSeconds, backoffSeconds, extension, ownerPrefix);
    }

    public WatchConfig withPollIntervalSeconds(int value) {
        return new WatchConfig(mode, value, backoffSeconds, extension, ownerPrefix);
    }

    public WatchConfig withBackoffSeconds(int value) {
        return new WatchConfig(mode, pollIntervalSeconds, value, extension, ownerPrefix);
    }
}
