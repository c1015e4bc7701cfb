package io.salesops.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path inputRoot,
    Path outputRoot,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
