package io.salesops.cli;

import io.salesops.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    WatchRunner watchRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (config, mode, once) -> {
            throw new UnsupportedOperationException("watch runner is not configured");
        });
    }
}
