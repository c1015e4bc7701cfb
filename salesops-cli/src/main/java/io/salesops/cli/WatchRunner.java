package io.salesops.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface WatchRunner {
    /**
     * Runs the poll loop.
     *
     * @param configPath configuration file to load
     * @param modeOverride {@code local} or {@code remote}, or null to keep the configured mode
     * @param once run a single cycle and return instead of looping
     * @return process exit code
     */
    int run(Path configPath, String modeOverride, boolean once) throws Exception;
}
