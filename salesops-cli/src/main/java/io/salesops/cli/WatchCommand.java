package io.salesops.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "watch", description = "Poll the input location and audit new or changed transcripts")
public final class WatchCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--config"}, description = "Config file (default: ~/.salesops/config.json)")
    Path config;

    @Option(names = {"--mode"}, description = "local or remote; overrides watch.mode")
    String mode;

    @Option(names = {"--once"}, description = "Run a single cycle and exit")
    boolean once;

    public WatchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path configPath = config == null ? context.configPath() : config;
        try {
            return context.watchRunner().run(configPath, mode, once);
        } catch (Exception e) {
            System.err.println("Watch command failed: " + e.getMessage());
            return 1;
        }
    }
}
