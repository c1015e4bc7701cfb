package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(boolean enabled, String host, int port) {

    public static ServerConfig defaults() {
        return new ServerConfig(true, "0.0.0.0", 10000);
    }

    public ServerConfig withPort(int value) {
        return new ServerConfig(enabled, host, value);
    }
}
